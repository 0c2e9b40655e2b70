package com.rcatrail.model;

import java.util.Locale;

public enum Severity {
    INFO,
    WARN,
    ERROR;

    /**
     * Lenient parse of a log level. Missing or unknown levels count as INFO,
     * "WARNING" is accepted for WARN.
     */
    public static Severity parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return INFO;
        }
        String level = raw.trim().toUpperCase(Locale.ROOT);
        return switch (level) {
            case "ERROR" -> ERROR;
            case "WARN", "WARNING" -> WARN;
            default -> INFO;
        };
    }
}
