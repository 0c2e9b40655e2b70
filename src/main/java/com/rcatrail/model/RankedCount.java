package com.rcatrail.model;

import lombok.Value;

/**
 * A key with its occurrence count, e.g. an error category or a failing node.
 */
@Value
public class RankedCount {
    String key;
    long count;
}
