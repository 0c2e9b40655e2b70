package com.rcatrail.dto;

import com.rcatrail.model.SourceKind;
import lombok.*;

/**
 * One forecast run row. A single row yields run_started and, once endedAt is
 * filled in, a terminal event.
 *
 * status: running | success | failed | timeout
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder(toBuilder = true)
public class RunRecord implements SourceRecord {

    private String runId;
    private String scenarioId;
    private String runBy;
    private String startedAt;
    private String endedAt;
    private String status;
    private String failReason;
    /** Defaults to runId when the source has no request id for the run. */
    private String correlationId;
    /** Node that failed the run, when the source knows it. */
    private String nodeId;
    private Long nodeFailureCount;

    @Override
    public SourceKind sourceKind() {
        return SourceKind.RUN;
    }

    @Override
    public String recordRef() {
        return runId;
    }
}
