package com.rcatrail.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class BatchReport {
    String batchId;
    boolean skippedAsDuplicate;
    int recordCount;
    int eventCount;
    int storedCount;
    /** Timeline length per scenario touched by the batch. */
    Map<String, Integer> scenarioEventCounts;
    AnomalyReport anomalies;
}
