package com.rcatrail.exception;

/**
 * Base of all request- or record-scoped failures. None of them is fatal to the process:
 * record failures become anomalies, request failures become error responses.
 */
public abstract class RcaException extends RuntimeException {

    protected RcaException(String message) {
        super(message);
    }

    protected RcaException(String message, Throwable cause) {
        super(message, cause);
    }
}
