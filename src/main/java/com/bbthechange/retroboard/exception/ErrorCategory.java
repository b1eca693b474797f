package com.bbthechange.retroboard.exception;

/**
 * Stable, machine-readable error categories. The routing layer maps each one to a transport status.
 */
public enum ErrorCategory {
    VALIDATION_ERROR,
    NOT_FOUND,
    FORBIDDEN,
    CONFLICT,
    LIMIT_REACHED,
    INVALID_RELATIONSHIP
}
