package com.bbthechange.retroboard.dto;

import com.bbthechange.retroboard.model.Reaction;
import com.bbthechange.retroboard.model.ReactionKind;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReactionDTO(String id, String cardId, ReactionKind reactionType, String userAlias, Instant createdAt) {

    public static ReactionDTO from(Reaction reaction) {
        return new ReactionDTO(reaction.getReactionId(), reaction.getCardId(), reaction.getReactionType(),
            reaction.getUserAlias(), reaction.getCreatedAt());
    }
}
