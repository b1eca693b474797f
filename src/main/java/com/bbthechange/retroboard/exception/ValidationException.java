package com.bbthechange.retroboard.exception;

/**
 * Malformed input: empty or oversized content, unknown column, unknown link type.
 */
public class ValidationException extends BoardDomainException {

    public ValidationException(String message) {
        super(ErrorCategory.VALIDATION_ERROR, "VALIDATION_ERROR", message);
    }

    public ValidationException(String code, String message) {
        super(ErrorCategory.VALIDATION_ERROR, code, message);
    }
}
