package com.rcatrail.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The canonical, source-agnostic audit event every computation works on.
 *
 * Immutable once built: the payload is copied into an unmodifiable map that keeps
 * the insertion order the normalizer chose, so serialized output is stable.
 *
 * Example:
 *   scenarioId    = "7d0c..."
 *   timestamp     = 2026-02-11T10:30:00Z
 *   eventType     = RUN_STARTED
 *   actor         = "jane.smith"
 *   correlationId = "req-42"
 *   runId         = "R1"
 *   payload       = {"run_id": "R1", "run_status": "failed"}
 */
@Value
public class Event {

    String scenarioId;
    Instant timestamp;
    EventType eventType;
    String actor;
    String correlationId;
    String runId;
    String nodeId;
    Long sequenceHint;
    Map<String, Object> payload;

    @Builder(toBuilder = true)
    private Event(String scenarioId, Instant timestamp, EventType eventType, String actor,
                  String correlationId, String runId, String nodeId, Long sequenceHint,
                  Map<String, Object> payload) {
        this.scenarioId = scenarioId;
        this.timestamp = timestamp;
        this.eventType = eventType;
        this.actor = actor;
        this.correlationId = correlationId;
        this.runId = runId;
        this.nodeId = nodeId;
        this.sequenceHint = sequenceHint;
        this.payload = payload == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    @JsonIgnore
    public EventIdentity getIdentity() {
        return new EventIdentity(scenarioId, eventType, timestamp, correlationId);
    }

    /**
     * Key of the source record this event came from. Unlike {@link #getIdentity()}
     * it tells apart distinct records that share scenario, type, timestamp and
     * correlation id, such as two nodes saved under one request or a log burst.
     */
    @JsonIgnore
    public String getRecordKey() {
        return EventContent.recordKey(this);
    }

    @JsonIgnore
    public SourceKind getSource() {
        return eventType.getSource();
    }

    public String payloadString(String key) {
        Object value = payload.get(key);
        return value == null ? null : value.toString();
    }

    public boolean payloadFlag(String key) {
        Object value = payload.get(key);
        return value instanceof Boolean ? (Boolean) value : Boolean.parseBoolean(String.valueOf(value));
    }

    public Long payloadLong(String key) {
        Object value = payload.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value.toString());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
