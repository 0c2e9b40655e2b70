package com.rcatrail.service;

import com.rcatrail.model.AnomalyKind;
import com.rcatrail.model.AnomalyReport;
import com.rcatrail.model.NormalizationAnomaly;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates the anomalies of one batch: every anomaly is counted, only the
 * first {@code sampleSize} are kept as samples. Not thread-safe; one per batch.
 */
class AnomalyCollector {

    private final int sampleSize;
    private final Map<AnomalyKind, Long> counts = new EnumMap<>(AnomalyKind.class);
    private final List<NormalizationAnomaly> samples = new ArrayList<>();
    private long total;

    AnomalyCollector(int sampleSize) {
        this.sampleSize = Math.max(0, sampleSize);
    }

    void record(NormalizationAnomaly anomaly) {
        total++;
        counts.merge(anomaly.getKind(), 1L, Long::sum);
        if (samples.size() < sampleSize) {
            samples.add(anomaly);
        }
    }

    void recordAll(Collection<NormalizationAnomaly> anomalies) {
        anomalies.forEach(this::record);
    }

    AnomalyReport toReport() {
        return new AnomalyReport(total, Map.copyOf(counts), List.copyOf(samples));
    }
}
