package com.rcatrail.model;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Anomalies surfaced by one batch: the total, a count per kind and the first few samples.
 */
@Value
public class AnomalyReport {
    long totalCount;
    Map<AnomalyKind, Long> countsByKind;
    List<NormalizationAnomaly> samples;

    public boolean isEmpty() {
        return totalCount == 0;
    }
}
