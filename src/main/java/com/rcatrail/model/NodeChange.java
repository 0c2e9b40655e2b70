package com.rcatrail.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Net change of one node between a baseline run and a target run: the hash in effect
 * when the baseline started against the hash in effect when the target started.
 */
@Value
@Builder
public class NodeChange {
    String nodeId;
    /** Null when there is no baseline run or the node had no value yet. */
    String baselineHash;
    String effectiveHash;
    Instant lastChangedAt;
    String lastChangedBy;
    int changeCount;
    HashTransition transition;
}
