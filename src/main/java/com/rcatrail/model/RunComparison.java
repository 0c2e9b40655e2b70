package com.rcatrail.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * What changed between a baseline run (run_a) and a target run (run_b).
 *
 * inputChanges holds every change with changedAt in (runA.startedAt, runB.startedAt],
 * in timeline order. changedNodes keeps one entry per node: the last change in that
 * window, i.e. the value the target run actually executed with.
 *
 * When no baseline exists runA is null, the window is open on the left and
 * sinceScenarioCreation is true.
 */
@Value
@Builder
public class RunComparison {
    String scenarioId;
    Run runA;
    Run runB;
    Duration timeGap;
    boolean sinceScenarioCreation;
    List<InputChangeRecord> inputChanges;
    List<NodeChange> changedNodes;
}
