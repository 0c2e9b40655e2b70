package com.rcatrail.model;

import lombok.Value;

import java.time.LocalDate;

@Value
public class DailySuccessRate {
    LocalDate day;
    long successfulRuns;
    long finishedRuns;

    public double getRate() {
        return finishedRuns == 0 ? 0.0 : (double) successfulRuns / finishedRuns;
    }
}
