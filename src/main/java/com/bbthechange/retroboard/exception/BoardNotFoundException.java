package com.bbthechange.retroboard.exception;

public class BoardNotFoundException extends BoardDomainException {

    public BoardNotFoundException(String message) {
        super(ErrorCategory.NOT_FOUND, "BOARD_NOT_FOUND", message);
    }
}
