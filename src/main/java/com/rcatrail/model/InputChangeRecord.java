package com.rcatrail.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One content-addressed version transition of a node's input.
 * previousHash == null marks the first known value for the node.
 */
@Value
@Builder
public class InputChangeRecord {
    String nodeId;
    Instant changedAt;
    String actor;
    String previousHash;
    String newHash;
    Long sequenceHint;
    String correlationId;

    public HashTransition getTransition() {
        return HashTransition.classify(previousHash, newHash);
    }

    /**
     * @throws IllegalArgumentException if the event is not an input_change
     */
    public static InputChangeRecord fromEvent(Event event) {
        if (event.getEventType() != EventType.INPUT_CHANGE) {
            throw new IllegalArgumentException("Not an input_change event: " + event.getEventType());
        }
        return InputChangeRecord.builder()
                .nodeId(event.getNodeId())
                .changedAt(event.getTimestamp())
                .actor(event.getActor())
                .previousHash(event.payloadString(PayloadKeys.PREVIOUS_HASH))
                .newHash(event.payloadString(PayloadKeys.NEW_HASH))
                .sequenceHint(event.getSequenceHint())
                .correlationId(event.getCorrelationId())
                .build();
    }
}
