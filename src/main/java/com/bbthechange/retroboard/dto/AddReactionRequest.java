package com.bbthechange.retroboard.dto;

import com.bbthechange.retroboard.model.ReactionKind;

public class AddReactionRequest {

    private ReactionKind reactionType = ReactionKind.THUMBS_UP;

    public AddReactionRequest() {}

    public AddReactionRequest(ReactionKind reactionType) {
        this.reactionType = reactionType;
    }

    public ReactionKind getReactionType() {
        return reactionType;
    }

    public void setReactionType(ReactionKind reactionType) {
        this.reactionType = reactionType;
    }
}
