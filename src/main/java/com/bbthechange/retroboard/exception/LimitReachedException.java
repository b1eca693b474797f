package com.bbthechange.retroboard.exception;

import java.util.Map;

/**
 * A per-user quota on the board is exhausted. Details carry the current count and the limit
 * so clients can render "3 of 3 used" without asking again.
 */
public class LimitReachedException extends BoardDomainException {

    private final long currentCount;
    private final int limit;

    private LimitReachedException(String code, String message, long currentCount, int limit) {
        super(ErrorCategory.LIMIT_REACHED, code, message,
            Map.of("currentCount", currentCount, "limit", limit));
        this.currentCount = currentCount;
        this.limit = limit;
    }

    public static LimitReachedException forCards(long currentCount, int limit) {
        return new LimitReachedException("CARD_LIMIT_REACHED",
            String.format("Card limit reached (%d/%d)", currentCount, limit), currentCount, limit);
    }

    public static LimitReachedException forReactions(long currentCount, int limit) {
        return new LimitReachedException("REACTION_LIMIT_REACHED",
            String.format("Reaction limit reached (%d/%d)", currentCount, limit), currentCount, limit);
    }

    public long getCurrentCount() {
        return currentCount;
    }

    public int getLimit() {
        return limit;
    }
}
