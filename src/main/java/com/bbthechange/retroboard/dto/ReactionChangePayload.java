package com.bbthechange.retroboard.dto;

import com.bbthechange.retroboard.model.ReactionKind;

/**
 * Event payload for reaction:added and reaction:removed. Carries the reacted card's counters
 * after the change so observers do not need to refetch.
 */
public record ReactionChangePayload(String cardId, String boardId, ReactionKind reactionType, String userAlias,
                                    int directReactionCount, int aggregatedReactionCount, String parentCardId) {
}
