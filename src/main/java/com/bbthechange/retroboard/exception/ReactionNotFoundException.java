package com.bbthechange.retroboard.exception;

public class ReactionNotFoundException extends BoardDomainException {

    public ReactionNotFoundException(String message) {
        super(ErrorCategory.NOT_FOUND, "REACTION_NOT_FOUND", message);
    }
}
