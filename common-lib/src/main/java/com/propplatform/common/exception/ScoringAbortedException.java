package com.propplatform.common.exception;

/**
 * A scoring run was abandoned (for example on a caller-imposed timeout).
 * No partial results are returned with it.
 */
public class ScoringAbortedException extends RuntimeException {

    public ScoringAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
