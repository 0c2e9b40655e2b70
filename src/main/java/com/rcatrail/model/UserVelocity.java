package com.rcatrail.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class UserVelocity {
    String userId;
    int windowDays;
    long totalActions;
    double actionsPerDay;
    int scenariosTouched;
    int activeDays;
    String mostFrequentAction;
    Map<String, Long> actionTypeDistribution;
}
