package com.rcatrail.dto;

import com.rcatrail.model.SourceKind;
import lombok.*;

/**
 * One line from the log aggregation backend.
 *
 * scenarioId may be missing on the wire; the batch processor resolves it through
 * runId or correlationId before normalization when it can.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder(toBuilder = true)
public class LogRecord implements SourceRecord {

    private String timestamp;
    private String severity;
    private String message;
    private String correlationId;
    private String scenarioId;
    private String runId;
    private String nodeId;
    private String userId;
    private String logStream;
    private boolean stackTrace;

    @Override
    public SourceKind sourceKind() {
        return SourceKind.LOG;
    }

    @Override
    public String recordRef() {
        if (correlationId != null) {
            return correlationId;
        }
        return runId != null ? runId : scenarioId;
    }
}
