package com.bbthechange.retroboard.exception;

/**
 * A conditional write or transaction was rejected because one of the cards it relied on
 * changed after it was read. Services re-read, re-validate and retry on this exception.
 */
public class VersionConflictException extends RuntimeException {

    public VersionConflictException(String message) {
        super(message);
    }

    public VersionConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
