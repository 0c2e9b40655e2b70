package com.rcatrail.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;

/**
 * Canonical form of an event's full content: every field plus the payload, as JSON
 * with map keys sorted at every level.
 *
 * Two events have the same canonical form only if they are equal in every field,
 * whatever map order or numeric width their payloads were built with. A stored
 * event read back from JSON therefore keeps the canonical form, and so the record
 * key, it had when it was normalized.
 */
public final class EventContent {

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private EventContent() {
    }

    public static String canonical(Event event) {
        Map<String, Object> content = new TreeMap<>();
        content.put("scenario_id", event.getScenarioId());
        content.put("event_type", event.getEventType() == null ? null : event.getEventType().getWireName());
        content.put("timestamp", event.getTimestamp() == null ? null : event.getTimestamp().toString());
        content.put("actor", event.getActor());
        content.put("correlation_id", event.getCorrelationId());
        content.put("run_id", event.getRunId());
        content.put("node_id", event.getNodeId());
        content.put("sequence_hint", event.getSequenceHint());
        content.put("payload", event.getPayload());
        try {
            return CANONICAL.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize event content of " + event.getIdentity().asKey(), e);
        }
    }

    /** Fixed-width digest of the canonical form, used as the store's unique key. */
    public static String recordKey(Event event) {
        return DigestUtils.md5DigestAsHex(canonical(event).getBytes(StandardCharsets.UTF_8));
    }
}
