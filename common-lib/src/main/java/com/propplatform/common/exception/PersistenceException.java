package com.propplatform.common.exception;

/**
 * The evaluator weight store could not complete an operation. A calibration run
 * that hits this error is rolled back as a whole.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
