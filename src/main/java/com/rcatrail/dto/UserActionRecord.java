package com.rcatrail.dto;

import com.rcatrail.model.SourceKind;
import lombok.*;

import java.util.Map;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder(toBuilder = true)
public class UserActionRecord implements SourceRecord {

    private String userId;
    private String scenarioId;
    private String actionTimestamp;
    private String actionType;
    private String actionCategory;
    private String targetEntityType;
    private String targetEntityId;
    private String correlationId;
    @Builder.Default
    private Boolean success = Boolean.TRUE;
    private Map<String, Object> details;

    @Override
    public SourceKind sourceKind() {
        return SourceKind.USER_ACTION;
    }

    @Override
    public String recordRef() {
        return correlationId != null ? correlationId : scenarioId;
    }
}
