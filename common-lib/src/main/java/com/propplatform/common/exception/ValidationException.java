package com.propplatform.common.exception;

/**
 * Malformed proposition, context or request. Raised before any evaluator runs
 * and always propagated to the caller.
 */
public class ValidationException extends RuntimeException {
    private final String field;

    public ValidationException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
