package com.rcatrail.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * A forecast run as derived from run events, with its per-run summary metrics.
 * Not a source of truth: always recomputed from the scenario's events.
 */
@Value
@Builder(toBuilder = true)
public class Run {
    String runId;
    String scenarioId;
    Instant startedAt;
    /** Absent while the run is in flight. */
    Instant endedAt;
    RunStatus status;
    String correlationId;
    String actor;
    String failReason;
    String failedNodeId;
    long errorLogCount;
    long nodeFailureCount;

    public Duration getDuration() {
        return endedAt == null ? null : Duration.between(startedAt, endedAt);
    }
}
