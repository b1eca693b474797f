package com.bbthechange.retroboard.service;

import com.bbthechange.retroboard.dto.ReactionDTO;
import com.bbthechange.retroboard.dto.ReactionResult;
import com.bbthechange.retroboard.model.ReactionKind;

import java.util.Optional;

public interface ReactionService {

    /**
     * First vote creates a reaction and bumps the counters; a repeat vote changes it in place.
     */
    ReactionResult addOrUpdateReaction(String cardId, String userHash, String alias, ReactionKind kind);

    void removeReaction(String cardId, String userHash);

    Optional<ReactionDTO> getUserReaction(String cardId, String userHash);
}
