package com.rcatrail.service;

import com.rcatrail.model.ErrorSummary;
import com.rcatrail.model.Event;
import com.rcatrail.model.Run;
import com.rcatrail.model.RunStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.List;

/**
 * Computes rollups over a supplied window of normalized events.
 *
 * Stateless: every call builds a fresh {@link MetricsRollup}. Shards are rolled
 * up independently and combined with {@link MetricsRollup#plus}, which gives the
 * same totals as one pass over all shards together.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsAggregator {

    private final RunAssembler runAssembler;

    public MetricsRollup rollup(Collection<Event> events) {
        return MetricsRollup.of(events);
    }

    public MetricsRollup rollupSharded(List<? extends Collection<Event>> shards) {
        MetricsRollup total = shards.stream()
                .map(MetricsRollup::of)
                .reduce(MetricsRollup.empty(), MetricsRollup::plus);
        log.debug("Rolled up {} shards", shards.size());
        return total;
    }

    /**
     * Reliability summary of one scenario: run counts from the run view, error
     * categories from the scenario's ERROR log entries.
     */
    public ErrorSummary errorSummary(String scenarioId, Collection<Event> events, int topN) {
        List<Run> runs = runAssembler.assemble(scenarioId, events);
        long failed = runs.stream().filter(r -> r.getStatus().isFailure()).count();
        long succeeded = runs.stream().filter(r -> r.getStatus() == RunStatus.SUCCESS).count();
        long finished = failed + succeeded;
        long nodeFailures = runs.stream().mapToLong(Run::getNodeFailureCount).sum();

        double successRate = finished == 0 ? 0.0
                : BigDecimal.valueOf(succeeded * 100)
                        .divide(BigDecimal.valueOf(finished), 2, RoundingMode.HALF_UP)
                        .doubleValue();

        return ErrorSummary.builder()
                .scenarioId(scenarioId)
                .totalRuns(runs.size())
                .failedRuns(failed)
                .successRate(successRate)
                .totalNodeFailures(nodeFailures)
                .errorCategories(MetricsRollup.of(events).topErrorCategories(topN))
                .build();
    }
}
