package com.bbthechange.retroboard.repository;

import com.bbthechange.retroboard.model.Board;

import java.util.Optional;

public interface BoardRepository {

    Board save(Board board);

    Optional<Board> findById(String boardId);

    /**
     * Append a user to the board's admins, conditioned on the board still being open, the
     * requester still being an admin and the candidate not being one yet.
     *
     * @throws com.bbthechange.retroboard.exception.VersionConflictException if any condition no longer holds
     */
    void addAdmin(String boardId, String newAdminHash, String requesterHash);
}
