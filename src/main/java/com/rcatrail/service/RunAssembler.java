package com.rcatrail.service;

import com.rcatrail.exception.AmbiguousTimestampException;
import com.rcatrail.model.Event;
import com.rcatrail.model.EventType;
import com.rcatrail.model.PayloadKeys;
import com.rcatrail.model.Run;
import com.rcatrail.model.RunStatus;
import com.rcatrail.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives the run view of a scenario from its events.
 *
 *   run_started                → runId, startedAt, actor, correlation id
 *   run_completed / run_failed → endedAt, final status, fail reason, failing node
 *   ERROR log_entry            → counted against the run it names, or against the
 *                                run sharing its correlation id when it names none
 *
 * nodeFailureCount is the source's own figure when the run row carried one,
 * otherwise the number of distinct nodes seen in the run's ERROR logs.
 */
@Component
@Slf4j
public class RunAssembler {

    static final Comparator<Run> START_ORDER = Comparator
            .comparing(Run::getStartedAt)
            .thenComparing(Run::getRunId);

    /**
     * @return the scenario's runs ordered by startedAt
     * @throws AmbiguousTimestampException if a run has an outcome but no start event,
     *                                     so it cannot be placed among the other runs
     */
    public List<Run> assemble(String scenarioId, Collection<Event> events) {
        Map<String, Run.RunBuilder> builders = new LinkedHashMap<>();
        Map<String, Event> terminals = new HashMap<>();
        List<Event> errorLogs = new ArrayList<>();

        for (Event event : events) {
            if (!scenarioId.equals(event.getScenarioId())) {
                continue;
            }
            if (event.getEventType() == EventType.RUN_STARTED) {
                builders.put(event.getRunId(), Run.builder()
                        .runId(event.getRunId())
                        .scenarioId(scenarioId)
                        .startedAt(event.getTimestamp())
                        .status(parseStatus(event))
                        .correlationId(event.getCorrelationId())
                        .actor(event.getActor()));
            } else if (event.getEventType().isRunTerminal()) {
                terminals.put(event.getRunId(), event);
            } else if (event.getEventType() == EventType.LOG_ENTRY
                    && Severity.parse(event.payloadString(PayloadKeys.SEVERITY)) == Severity.ERROR) {
                errorLogs.add(event);
            }
        }

        for (Map.Entry<String, Event> entry : terminals.entrySet()) {
            Run.RunBuilder builder = builders.get(entry.getKey());
            if (builder == null) {
                throw new AmbiguousTimestampException("Run " + entry.getKey() + " of scenario " + scenarioId
                        + " has an outcome but no start event; it cannot be ordered");
            }
            Event terminal = entry.getValue();
            builder.endedAt(terminal.getTimestamp())
                    .status(parseStatus(terminal))
                    .failReason(terminal.payloadString(PayloadKeys.FAIL_REASON))
                    .failedNodeId(terminal.getNodeId());
        }

        Map<String, String> runByCorrelation = new HashMap<>();
        builders.forEach((runId, builder) -> {
            Run partial = builder.build();
            if (partial.getCorrelationId() != null) {
                runByCorrelation.putIfAbsent(partial.getCorrelationId(), runId);
            }
        });

        Map<String, Long> errorCounts = new HashMap<>();
        Map<String, Set<String>> failingNodes = new HashMap<>();
        for (Event logEvent : errorLogs) {
            String runId = logEvent.getRunId() != null
                    ? logEvent.getRunId()
                    : runByCorrelation.get(logEvent.getCorrelationId());
            if (runId == null || !builders.containsKey(runId)) {
                continue;
            }
            errorCounts.merge(runId, 1L, Long::sum);
            if (logEvent.getNodeId() != null) {
                failingNodes.computeIfAbsent(runId, k -> new HashSet<>()).add(logEvent.getNodeId());
            }
        }

        List<Run> runs = new ArrayList<>(builders.size());
        for (Map.Entry<String, Run.RunBuilder> entry : builders.entrySet()) {
            String runId = entry.getKey();
            Event terminal = terminals.get(runId);
            Long reported = terminal == null ? null : terminal.payloadLong(PayloadKeys.NODE_FAILURE_COUNT);
            long derived = failingNodes.getOrDefault(runId, Set.of()).size();
            runs.add(entry.getValue()
                    .errorLogCount(errorCounts.getOrDefault(runId, 0L))
                    .nodeFailureCount(reported != null ? reported : derived)
                    .build());
        }
        runs.sort(START_ORDER);

        log.debug("Assembled {} runs for scenario {}", runs.size(), scenarioId);
        return runs;
    }

    private RunStatus parseStatus(Event event) {
        try {
            return RunStatus.parse(event.payloadString(PayloadKeys.RUN_STATUS));
        } catch (IllegalArgumentException e) {
            log.warn("Unknown run status '{}' on run {}, treating as failed",
                    event.payloadString(PayloadKeys.RUN_STATUS), event.getRunId());
            return RunStatus.FAILED;
        }
    }
}
