package com.rcatrail.service;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.regex.Pattern;

/**
 * Resolves the timestamp strings found in source rows to UTC instants.
 *
 * Accepted forms:
 *   "2026-02-11T10:00:00Z"          → as is
 *   "2026-02-11T10:00:00+02:00"     → shifted to UTC
 *   "2026-02-11T10:00:00"           → zone-less, read as UTC
 *   "2026-02-11 10:00:00.123456"    → database style, read as UTC
 */
final class TimestampParser {

    private static final Pattern SPACE_SEPARATED = Pattern.compile("^\\d{4}-\\d{2}-\\d{2} \\d.*");

    private TimestampParser() {
    }

    /**
     * @return the instant, or null when the value is absent
     * @throws DateTimeParseException when a value is present but cannot be read
     */
    static Instant parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        if (SPACE_SEPARATED.matcher(value).matches()) {
            value = value.replaceFirst(" ", "T");
        }
        TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                .parseBest(value, OffsetDateTime::from, LocalDateTime::from);
        if (parsed instanceof OffsetDateTime) {
            return ((OffsetDateTime) parsed).toInstant();
        }
        return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
    }
}
