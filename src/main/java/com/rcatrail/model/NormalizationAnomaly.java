package com.rcatrail.model;

import lombok.Value;

@Value
public class NormalizationAnomaly {
    SourceKind source;
    AnomalyKind kind;
    /** Best available reference to the offending row (scenario, run or correlation id). */
    String recordRef;
    String reason;
}
