package com.rcatrail.dto;

import com.rcatrail.model.SourceKind;

/**
 * A flat row from one of the upstream feeds. Timestamps arrive as nullable
 * ISO-8601 strings and are only resolved by the normalizer.
 */
public interface SourceRecord {

    SourceKind sourceKind();

    /** Best identifier to quote when the row is reported as an anomaly. */
    String recordRef();
}
