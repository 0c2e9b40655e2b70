package com.rcatrail.dto;

import com.rcatrail.model.Event;
import lombok.*;

import java.util.List;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class AuditTrailResponse {
    private String scenarioId;
    private int eventCount;
    private List<Event> events;
}
