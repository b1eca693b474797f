package com.bbthechange.retroboard.repository;

/**
 * An atomic change to one card's reaction counters, applied with an ADD-style update expression
 * inside the same transaction as the reaction write.
 *
 * @param cardId card whose counters change
 * @param directDelta change to directReactionCount
 * @param aggregatedDelta change to aggregatedReactionCount
 * @param guardParent whether the write must verify the card's parent pointer
 * @param expectedParentId parent the card must still point at (null means "no parent")
 */
public record CounterDelta(String cardId, int directDelta, int aggregatedDelta,
                           boolean guardParent, String expectedParentId) {

    /**
     * Delta for the card that was reacted on. Guarded on its parent so a concurrent
     * link or unlink cannot leave the old parent's aggregate stale.
     */
    public static CounterDelta onReactedCard(String cardId, String parentCardId, int delta) {
        return new CounterDelta(cardId, delta, delta, true, parentCardId);
    }

    /**
     * Delta for the parent of the reacted card: only its aggregate moves.
     */
    public static CounterDelta onParent(String parentCardId, int delta) {
        return new CounterDelta(parentCardId, 0, delta, false, null);
    }
}
