package com.bbthechange.retroboard.service;

import com.bbthechange.retroboard.exception.BoardClosedException;
import com.bbthechange.retroboard.exception.BoardNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Consulted at the start of every mutating card, relationship and reaction operation.
 */
@Component
public class BoardLifecycleGuard {

    private static final Logger logger = LoggerFactory.getLogger(BoardLifecycleGuard.class);

    private final BoardService boardService;

    @Autowired
    public BoardLifecycleGuard(BoardService boardService) {
        this.boardService = boardService;
    }

    public void ensureOpen(String boardId) {
        if (!boardService.boardExists(boardId)) {
            throw new BoardNotFoundException("Board not found: " + boardId);
        }
        if (!boardService.isOpen(boardId)) {
            logger.warn("Rejected change on closed board {}", boardId);
            throw new BoardClosedException(boardId);
        }
    }
}
