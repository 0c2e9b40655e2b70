package com.rcatrail.model;

import lombok.Value;

import java.time.Instant;

/**
 * Natural key of a canonical event. Normalizing the same source row twice yields
 * events with equal identities, which is what makes re-running a batch idempotent.
 */
@Value
public class EventIdentity {
    String scenarioId;
    EventType eventType;
    Instant timestamp;
    String correlationId;

    /** Single-column form used by the reporting store's unique index. */
    public String asKey() {
        return scenarioId + "|" + eventType.getWireName() + "|" + timestamp + "|"
                + (correlationId == null ? "" : correlationId);
    }
}
