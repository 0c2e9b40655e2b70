package com.rcatrail.model;

import java.util.Objects;

/**
 * Outcome of comparing two successive content hashes of one node's input.
 * How the hashes are computed is the source system's business.
 */
public enum HashTransition {
    /** No earlier version was known. */
    INITIAL,
    CHANGED,
    /** Same content saved again. */
    UNCHANGED;

    public static HashTransition classify(String previousHash, String newHash) {
        if (Objects.equals(previousHash, newHash)) {
            return UNCHANGED;
        }
        if (previousHash == null) {
            return INITIAL;
        }
        return CHANGED;
    }
}
