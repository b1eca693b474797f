package com.bbthechange.retroboard.exception;

public class CardNotFoundException extends BoardDomainException {

    public CardNotFoundException(String message) {
        super(ErrorCategory.NOT_FOUND, "CARD_NOT_FOUND", message);
    }
}
