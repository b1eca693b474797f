package com.bbthechange.retroboard.event;

import java.time.Instant;

/**
 * A committed change on a board, addressed to the board's room.
 *
 * @param type what happened
 * @param boardId board whose observers should hear about it
 * @param payload public fields of the changed entity (never owner or reactor hashes)
 * @param occurredAt when the change was committed
 */
public record BoardEvent(BoardEventType type, String boardId, Object payload, Instant occurredAt) {

    public static BoardEvent of(BoardEventType type, String boardId, Object payload) {
        return new BoardEvent(type, boardId, payload, Instant.now());
    }
}
