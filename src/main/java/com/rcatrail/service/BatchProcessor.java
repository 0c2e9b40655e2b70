package com.rcatrail.service;

import com.rcatrail.config.RcaTrailProperties;
import com.rcatrail.dto.InputChangeRow;
import com.rcatrail.dto.LogRecord;
import com.rcatrail.dto.RunRecord;
import com.rcatrail.dto.SourceBatch;
import com.rcatrail.dto.SourceRecord;
import com.rcatrail.exception.MalformedRecordException;
import com.rcatrail.model.AnomalyKind;
import com.rcatrail.model.AnomalyReport;
import com.rcatrail.model.BatchReport;
import com.rcatrail.model.Event;
import com.rcatrail.model.NormalizationAnomaly;
import com.rcatrail.model.PayloadKeys;
import com.rcatrail.model.SourceKind;
import com.rcatrail.model.Timeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * The core pipeline: one {@link SourceBatch} in, normalized timelines stored.
 *
 * FLOW:
 *   SourceBatch
 *       ↓
 *   claim batch id (Redis SET NX) ── already claimed → skipped report
 *       ↓
 *   sequence input changes (continuing stored history), attribute scenario-less logs
 *       ↓
 *   normalize every row ── MalformedRecordException → anomaly, row skipped
 *       ↓
 *   merge each scenario's timeline on the worker pool (one task per scenario)
 *       ↓
 *   persist all events in one transaction, publish anomalies
 *
 * A failure after the claim releases it and propagates, so nothing partial is
 * visible and the whole batch can be retried.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BatchProcessor {

    private final EventNormalizer normalizer;
    private final InputChangeSequencer sequencer;
    private final TimelineMerger merger;
    private final AuditEventStore store;
    private final BatchDeduplicationService deduplicationService;
    private final AnomalyPublisher anomalyPublisher;
    private final RcaTrailProperties properties;
    @Qualifier("scenarioWorkerExecutor")
    private final Executor scenarioWorkerExecutor;

    public BatchReport process(SourceBatch batch) {
        String batchId = batch.getBatchId();
        if (!deduplicationService.tryAcquire(batchId)) {
            return BatchReport.builder()
                    .batchId(batchId)
                    .skippedAsDuplicate(true)
                    .recordCount(batch.recordCount())
                    .scenarioEventCounts(Map.of())
                    .anomalies(new AnomalyReport(0, Map.of(), List.of()))
                    .build();
        }

        try {
            BatchReport report = run(batch);
            anomalyPublisher.publishAnomalies(batchId, report.getAnomalies());
            log.info("Batch processed: batchId={}, records={}, events={}, stored={}, scenarios={}, anomalies={}",
                    batchId, report.getRecordCount(), report.getEventCount(), report.getStoredCount(),
                    report.getScenarioEventCounts().size(), report.getAnomalies().getTotalCount());
            return report;
        } catch (RuntimeException e) {
            log.error("Batch {} failed, nothing stored: {}", batchId, e.getMessage(), e);
            deduplicationService.release(batchId);
            throw e;
        }
    }

    private BatchReport run(SourceBatch batch) {
        AnomalyCollector anomalies = new AnomalyCollector(properties.getAnomalies().getSampleSize());
        List<Event> events = new ArrayList<>();

        normalizeAll(SourceKind.SCENARIO, nonNull(batch.getScenarios()), events, anomalies);
        List<InputChangeRow> inputChanges =
                sequencer.sequence(nonNull(batch.getInputChanges()), store::latestInputChangeBefore);
        normalizeAll(SourceKind.INPUT_CHANGE, inputChanges, events, anomalies);
        normalizeAll(SourceKind.RUN, nonNull(batch.getRuns()), events, anomalies);
        normalizeAll(SourceKind.LOG, attributeLogs(nonNull(batch.getLogs()), nonNull(batch.getRuns())), events, anomalies);
        normalizeAll(SourceKind.USER_ACTION, nonNull(batch.getUserActions()), events, anomalies);
        recordLifecycleAnomalies(events, anomalies);

        Map<String, List<Event>> byScenario = new TreeMap<>();
        for (Event event : events) {
            byScenario.computeIfAbsent(event.getScenarioId(), k -> new ArrayList<>()).add(event);
        }

        Map<String, Integer> scenarioCounts = new LinkedHashMap<>();
        List<Event> merged = new ArrayList<>(events.size());
        for (Timeline timeline : mergeAll(byScenario)) {
            anomalies.recordAll(timeline.getAnomalies());
            scenarioCounts.put(timeline.getScenarioId(), timeline.getEvents().size());
            merged.addAll(timeline.getEvents());
        }

        int stored = store.persistBatch(batch.getBatchId(), merged);

        return BatchReport.builder()
                .batchId(batch.getBatchId())
                .recordCount(batch.recordCount())
                .eventCount(merged.size())
                .storedCount(stored)
                .scenarioEventCounts(scenarioCounts)
                .anomalies(anomalies.toReport())
                .build();
    }

    private void normalizeAll(SourceKind kind, List<? extends SourceRecord> rows,
                              List<Event> events, AnomalyCollector anomalies) {
        for (SourceRecord row : rows) {
            try {
                events.addAll(normalizer.normalize(kind, row));
            } catch (MalformedRecordException e) {
                log.warn("Skipping malformed {} record {}: {}", kind, e.getRecordRef(), e.getMessage());
                anomalies.record(new NormalizationAnomaly(kind, AnomalyKind.MALFORMED_RECORD,
                        e.getRecordRef(), e.getMessage()));
            }
        }
    }

    /**
     * Logs often carry only a run id or the run's correlation id. Their scenario is
     * taken from the runs of this batch first, then from runs stored earlier.
     */
    private List<LogRecord> attributeLogs(List<LogRecord> logs, List<RunRecord> runs) {
        Map<String, String> scenarioByRun = new HashMap<>();
        Map<String, String> scenarioByCorrelation = new HashMap<>();
        for (RunRecord run : runs) {
            if (run.getScenarioId() == null || run.getRunId() == null) {
                continue;
            }
            scenarioByRun.putIfAbsent(run.getRunId(), run.getScenarioId());
            String correlationId = run.getCorrelationId() != null ? run.getCorrelationId() : run.getRunId();
            scenarioByCorrelation.putIfAbsent(correlationId, run.getScenarioId());
        }

        List<LogRecord> attributed = new ArrayList<>(logs.size());
        for (LogRecord logRecord : logs) {
            if (logRecord.getScenarioId() != null && !logRecord.getScenarioId().isBlank()) {
                attributed.add(logRecord);
                continue;
            }
            String scenarioId = null;
            if (logRecord.getRunId() != null) {
                scenarioId = scenarioByRun.get(logRecord.getRunId());
                if (scenarioId == null) {
                    scenarioId = store.scenarioOfRun(logRecord.getRunId()).orElse(null);
                }
            }
            if (scenarioId == null && logRecord.getCorrelationId() != null) {
                scenarioId = scenarioByCorrelation.get(logRecord.getCorrelationId());
            }
            attributed.add(scenarioId == null ? logRecord : logRecord.toBuilder().scenarioId(scenarioId).build());
        }
        return attributed;
    }

    // One anomaly per flagged source row, not per event
    private void recordLifecycleAnomalies(List<Event> events, AnomalyCollector anomalies) {
        Set<String> seen = new LinkedHashSet<>();
        for (Event event : events) {
            if (!event.payloadFlag(PayloadKeys.LIFECYCLE_ANOMALY)) {
                continue;
            }
            String ref = event.getRunId() != null ? event.getRunId() : event.getScenarioId();
            String detail = event.payloadString(PayloadKeys.ANOMALY_DETAIL);
            if (seen.add(event.getSource() + "|" + ref + "|" + detail)) {
                anomalies.record(new NormalizationAnomaly(event.getSource(),
                        AnomalyKind.LIFECYCLE_OUT_OF_ORDER, ref, detail));
            }
        }
    }

    private List<Timeline> mergeAll(Map<String, List<Event>> byScenario) {
        List<CompletableFuture<Timeline>> futures = new ArrayList<>(byScenario.size());
        byScenario.forEach((scenarioId, slice) -> futures.add(
                CompletableFuture.supplyAsync(() -> merger.merge(scenarioId, slice), scenarioWorkerExecutor)));
        try {
            return futures.stream().map(CompletableFuture::join).toList();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    private static <T> List<T> nonNull(List<T> rows) {
        return rows == null ? List.of() : rows;
    }
}
