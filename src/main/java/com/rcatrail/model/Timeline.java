package com.rcatrail.model;

import lombok.Value;

import java.util.List;

/**
 * One scenario's merged audit trail plus whatever had to be left out of it.
 */
@Value
public class Timeline {
    String scenarioId;
    List<Event> events;
    /** Events excluded for lack of a timestamp. */
    List<NormalizationAnomaly> anomalies;
    int duplicatesDropped;
}
