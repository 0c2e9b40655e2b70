package com.rcatrail.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RunStatus {
    RUNNING,
    SUCCESS,
    FAILED,
    TIMEOUT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isFailure() {
        return this == FAILED || this == TIMEOUT;
    }

    /**
     * Parses a source status string. Blank means the run is still in flight.
     *
     * @throws IllegalArgumentException for a status outside the known set
     */
    public static RunStatus parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return RUNNING;
        }
        return RunStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
