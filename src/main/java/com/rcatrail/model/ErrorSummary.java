package com.rcatrail.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ErrorSummary {
    String scenarioId;
    long totalRuns;
    long failedRuns;
    /** Percentage of finished runs that succeeded, two decimals. */
    double successRate;
    long totalNodeFailures;
    List<RankedCount> errorCategories;
}
