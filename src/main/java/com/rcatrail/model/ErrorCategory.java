package com.rcatrail.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ErrorCategory {
    VALIDATION,
    TIMEOUT,
    DATABASE,
    CALCULATION,
    UNCATEGORIZED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
