package com.bbthechange.retroboard.exception;

/**
 * A card mutation kept conflicting with concurrent writers and ran out of retries.
 */
public class TransactionFailedException extends RuntimeException {

    private final String operation;
    private final int attempts;

    public TransactionFailedException(String message) {
        super(message);
        this.operation = null;
        this.attempts = 0;
    }

    public TransactionFailedException(String operation, int attempts, VersionConflictException lastConflict) {
        super("Failed to " + operation + " after " + attempts + " attempts due to concurrent modifications", lastConflict);
        this.operation = operation;
        this.attempts = attempts;
    }

    /** The retried operation name, or null when raised outside the retrier. */
    public String getOperation() {
        return operation;
    }

    public int getAttempts() {
        return attempts;
    }
}
