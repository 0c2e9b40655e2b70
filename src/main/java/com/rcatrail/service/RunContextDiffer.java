package com.rcatrail.service;

import com.rcatrail.exception.AmbiguousTimestampException;
import com.rcatrail.exception.NoRunsForScenarioException;
import com.rcatrail.exception.RunNotFoundException;
import com.rcatrail.model.HashTransition;
import com.rcatrail.model.InputChangeRecord;
import com.rcatrail.model.NodeChange;
import com.rcatrail.model.Run;
import com.rcatrail.model.RunComparison;
import com.rcatrail.model.RunStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Answers "what was different this time?" for a run.
 *
 * FLOW:
 *   1. Locate the target run (run_b)
 *   2. Baseline (run_a) = the successful run with the latest startedAt strictly
 *      before run_b's start; none means "compare against scenario creation"
 *   3. Window = (run_a.startedAt, run_b.startedAt]
 *        a change at run_a's start was already reflected in run_a → excluded
 *        a change at run_b's start is what run_b ran with     → included
 *   4. Per node, keep the last change in the window and compare its hash with the
 *      hash in effect when run_a started
 *
 * Example: changes to node X at 10:15 (h1→h2) and 10:40 (h2→h3), failed run R1 at
 * 10:30, run R2 at 10:50. Target R2 has no earlier success, so both changes are
 * reported and node X's effective hash is h3.
 */
@Component
@Slf4j
public class RunContextDiffer {

    /**
     * Compares a run against the last successful run before it.
     *
     * @throws NoRunsForScenarioException if the scenario has no runs at all
     * @throws RunNotFoundException       if the target run is not among them
     */
    public RunComparison diff(String scenarioId, List<Run> runs, Collection<InputChangeRecord> changes,
                              String targetRunId) {
        Run target = find(scenarioId, runs, targetRunId);

        Run baseline = null;
        for (Run run : runs) {
            if (run.getStatus() != RunStatus.SUCCESS || !run.getStartedAt().isBefore(target.getStartedAt())) {
                continue;
            }
            if (baseline == null || RunAssembler.START_ORDER.compare(run, baseline) > 0) {
                baseline = run;
            }
        }

        log.info("Run context diff: scenario={}, target={}, baseline={}",
                scenarioId, targetRunId, baseline == null ? "none" : baseline.getRunId());
        return build(scenarioId, baseline, target, changes);
    }

    /**
     * Compares two explicit runs; the earlier one becomes run_a whatever the argument order.
     *
     * @throws AmbiguousTimestampException if both runs started at the same instant
     */
    public RunComparison compare(String scenarioId, List<Run> runs, Collection<InputChangeRecord> changes,
                                 String firstRunId, String secondRunId) {
        if (firstRunId.equals(secondRunId)) {
            throw new IllegalArgumentException("Cannot compare run " + firstRunId + " with itself");
        }
        Run first = find(scenarioId, runs, firstRunId);
        Run second = find(scenarioId, runs, secondRunId);
        if (first.getStartedAt().equals(second.getStartedAt())) {
            throw new AmbiguousTimestampException("Runs " + firstRunId + " and " + secondRunId
                    + " both started at " + first.getStartedAt() + "; no baseline can be chosen");
        }
        boolean firstIsEarlier = first.getStartedAt().isBefore(second.getStartedAt());
        return build(scenarioId, firstIsEarlier ? first : second, firstIsEarlier ? second : first, changes);
    }

    private Run find(String scenarioId, List<Run> runs, String runId) {
        if (runs.isEmpty()) {
            throw new NoRunsForScenarioException(scenarioId);
        }
        return runs.stream()
                .filter(r -> r.getRunId().equals(runId))
                .findFirst()
                .orElseThrow(() -> new RunNotFoundException(scenarioId, runId));
    }

    private RunComparison build(String scenarioId, Run runA, Run runB, Collection<InputChangeRecord> changes) {
        InputHistory history = new InputHistory(changes);
        Instant after = runA == null ? null : runA.getStartedAt();
        Instant upTo = runB.getStartedAt();

        List<InputChangeRecord> window = history.changesIn(after, upTo);

        List<NodeChange> changedNodes = new ArrayList<>();
        for (String nodeId : history.nodeIds()) {
            history.lastChangeIn(nodeId, after, upTo).ifPresent(last -> {
                String baselineHash = after == null ? null : history.valueAt(nodeId, after);
                changedNodes.add(NodeChange.builder()
                        .nodeId(nodeId)
                        .baselineHash(baselineHash)
                        .effectiveHash(last.getNewHash())
                        .lastChangedAt(last.getChangedAt())
                        .lastChangedBy(last.getActor())
                        .changeCount(history.countIn(nodeId, after, upTo))
                        .transition(HashTransition.classify(baselineHash, last.getNewHash()))
                        .build());
            });
        }

        return RunComparison.builder()
                .scenarioId(scenarioId)
                .runA(runA)
                .runB(runB)
                .timeGap(runA == null ? null : Duration.between(runA.getStartedAt(), runB.getStartedAt()))
                .sinceScenarioCreation(runA == null)
                .inputChanges(List.copyOf(window))
                .changedNodes(List.copyOf(changedNodes))
                .build();
    }
}
