package com.bbthechange.retroboard.exception;

/**
 * Thrown by RetroKeyFactory when an id or user hash cannot form a valid key.
 */
public class InvalidKeyException extends RuntimeException {

    public InvalidKeyException(String message) {
        super(message);
    }
}
