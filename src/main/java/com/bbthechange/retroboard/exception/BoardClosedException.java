package com.bbthechange.retroboard.exception;

/**
 * Thrown by the lifecycle guard when a mutation targets a board that is no longer open.
 */
public class BoardClosedException extends BoardDomainException {

    public BoardClosedException(String boardId) {
        super(ErrorCategory.CONFLICT, "BOARD_CLOSED", "Board is closed: " + boardId);
    }
}
