package com.bbthechange.retroboard.exception;

/**
 * Wraps DynamoDB failures raised by the card, reaction and board repositories.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
