package com.rcatrail.model;

/**
 * Which upstream feed a record came from.
 *
 * The declaration order is also the ingestion order used as the last-resort
 * tie-break when the timeline is merged.
 */
public enum SourceKind {
    SCENARIO,
    INPUT_CHANGE,
    RUN,
    LOG,
    USER_ACTION
}
