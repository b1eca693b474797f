package com.bbthechange.retroboard.repository;

import com.bbthechange.retroboard.model.Reaction;

import java.util.List;
import java.util.Optional;

public interface ReactionRepository {

    Optional<Reaction> findByCardAndUser(String cardId, String userHash);

    List<Reaction> findByCardId(String cardId);

    /**
     * Reactions the user has placed on any card of the board.
     */
    long countByBoardAndUser(String boardId, String userHash);

    /**
     * Store a first-time reaction together with its counter deltas, atomically.
     */
    void insert(Reaction reaction, List<CounterDelta> deltas);

    /**
     * Change the kind and alias of an existing reaction. Counters are untouched.
     */
    Reaction update(Reaction reaction);

    /**
     * Remove a reaction together with its counter deltas, atomically.
     */
    void delete(Reaction reaction, List<CounterDelta> deltas);
}
