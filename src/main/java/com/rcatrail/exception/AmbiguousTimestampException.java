package com.rcatrail.exception;

/**
 * Two things that must be ordered relative to each other cannot be, because a
 * timestamp is missing or they share the same instant.
 */
public class AmbiguousTimestampException extends RcaException {

    public AmbiguousTimestampException(String message) {
        super(message);
    }
}
