package com.rcatrail.model;

public enum AnomalyKind {
    /** Source row unusable: scenario id or a resolvable timestamp missing. */
    MALFORMED_RECORD,
    /** An event that must be ordered carries no usable timestamp. */
    AMBIGUOUS_TIMESTAMP,
    /** Lifecycle timestamps contradict created < submitted < locked. Events are still emitted. */
    LIFECYCLE_OUT_OF_ORDER
}
