package com.bbthechange.retroboard.service;

import com.bbthechange.retroboard.dto.BoardDTO;
import com.bbthechange.retroboard.dto.CreateBoardRequest;

/**
 * Board metadata and the predicates the card engine consults about a board.
 */
public interface BoardService {

    BoardDTO createBoard(CreateBoardRequest request, String userHash);

    BoardDTO getBoard(String boardId, String userHash);

    /**
     * Close a board to further changes. Admins only; closing a closed board is a no-op.
     */
    BoardDTO closeBoard(String boardId, String userHash);

    /**
     * Make another participant a board admin. Admins only, open boards only; promoting an
     * existing admin is a no-op.
     */
    BoardDTO addAdmin(String boardId, String newAdminHash, String requesterHash);

    boolean boardExists(String boardId);

    boolean isOpen(String boardId);

    boolean columnExists(String boardId, String columnId);

    /**
     * Feedback cards a user may create on the board, or null for unlimited.
     */
    Integer getCardLimit(String boardId);

    /**
     * Reactions a user may place on the board, or null for unlimited.
     */
    Integer getReactionLimit(String boardId);

    boolean isAdmin(String boardId, String userHash);
}
