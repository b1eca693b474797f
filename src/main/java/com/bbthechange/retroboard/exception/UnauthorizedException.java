package com.bbthechange.retroboard.exception;

/**
 * Thrown when the requester is neither the owner nor, where admins are allowed, a board admin.
 */
public class UnauthorizedException extends BoardDomainException {

    public UnauthorizedException(String message) {
        super(ErrorCategory.FORBIDDEN, "FORBIDDEN", message);
    }
}
