package com.rcatrail.dto;

import com.rcatrail.model.SourceKind;
import lombok.*;

/**
 * One saved version of a node's input data.
 *
 * previousHash and changeSequence are optional: when the source omits them,
 * InputChangeSequencer derives them from the node's earlier rows.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder(toBuilder = true)
public class InputChangeRow implements SourceRecord {

    private String scenarioId;
    private String nodeId;
    private String changedAt;
    private String changedBy;
    private String inputHash;
    private String previousHash;
    private Long changeSequence;
    private String correlationId;

    @Override
    public SourceKind sourceKind() {
        return SourceKind.INPUT_CHANGE;
    }

    @Override
    public String recordRef() {
        return correlationId != null ? correlationId : scenarioId + "/" + nodeId;
    }
}
