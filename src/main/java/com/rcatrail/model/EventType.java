package com.rcatrail.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Arrays;

/**
 * Discriminant of the canonical event.
 *
 * priority orders events that share a timestamp: state and input changes are
 * assumed to precede the runs and logs they trigger, and run outcomes come last.
 * RUN_COMPLETED and RUN_FAILED share a rank.
 */
@Getter
public enum EventType {
    STATE_CHANGE("state_change", 0, SourceKind.SCENARIO),
    INPUT_CHANGE("input_change", 1, SourceKind.INPUT_CHANGE),
    RUN_STARTED("run_started", 2, SourceKind.RUN),
    LOG_ENTRY("log_entry", 3, SourceKind.LOG),
    USER_ACTION("user_action", 4, SourceKind.USER_ACTION),
    RUN_COMPLETED("run_completed", 5, SourceKind.RUN),
    RUN_FAILED("run_failed", 5, SourceKind.RUN);

    private final String wireName;
    private final int priority;
    private final SourceKind source;

    EventType(String wireName, int priority, SourceKind source) {
        this.wireName = wireName;
        this.priority = priority;
        this.source = source;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean isRunTerminal() {
        return this == RUN_COMPLETED || this == RUN_FAILED;
    }

    @JsonCreator
    public static EventType fromWireName(String value) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown event type: " + value));
    }
}
