package com.rcatrail.dto;

import com.rcatrail.model.SourceKind;
import lombok.*;

/**
 * Lifecycle columns of one scenario row.
 *
 * Each *At field that is present becomes one state_change event:
 *   createdAt   → null      → draft
 *   submittedAt → draft     → submitted
 *   lockedAt    → submitted → locked
 *   withdrawAt  → (status)  → withdrawn
 *   deleteAt    → (status)  → deleted
 *
 * The *ReqId columns are the request ids that caused each transition and become
 * the events' correlation ids.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder(toBuilder = true)
public class ScenarioRecord implements SourceRecord {

    private String scenarioId;
    private String status;

    private String createdAt;
    private String createdBy;
    private String createdReqId;

    private String submittedAt;
    private String submittedBy;
    private String submittedReqId;

    private String lockedAt;
    private String lockedBy;
    private String lockedReqId;

    private String withdrawAt;
    private String withdrawBy;
    private String withdrawReqId;

    private String deleteAt;
    private String deleteBy;
    private String deleteReqId;

    @Override
    public SourceKind sourceKind() {
        return SourceKind.SCENARIO;
    }

    @Override
    public String recordRef() {
        return scenarioId;
    }
}
