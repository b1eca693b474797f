package com.bbthechange.retroboard.service.impl;

import com.bbthechange.retroboard.dto.CardQuotaDTO;
import com.bbthechange.retroboard.dto.ReactionQuotaDTO;
import com.bbthechange.retroboard.exception.BoardNotFoundException;
import com.bbthechange.retroboard.repository.CardRepository;
import com.bbthechange.retroboard.repository.ReactionRepository;
import com.bbthechange.retroboard.service.BoardService;
import com.bbthechange.retroboard.service.QuotaService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Quotas are read-then-compared. Two requests racing at the limit can both pass; the
 * overshoot is bounded by the number of concurrent requests from one user.
 */
@Service
public class QuotaServiceImpl implements QuotaService {

    private static final Logger logger = LoggerFactory.getLogger(QuotaServiceImpl.class);

    private final BoardService boardService;
    private final CardRepository cardRepository;
    private final ReactionRepository reactionRepository;

    @Autowired
    public QuotaServiceImpl(BoardService boardService, CardRepository cardRepository,
                            ReactionRepository reactionRepository) {
        this.boardService = boardService;
        this.cardRepository = cardRepository;
        this.reactionRepository = reactionRepository;
    }

    @Override
    public CardQuotaDTO getCardQuota(String boardId, String userHash) {
        requireBoard(boardId);
        Integer limit = boardService.getCardLimit(boardId);
        long current = cardRepository.countFeedbackCards(boardId, userHash);
        boolean enabled = limit != null;

        logger.debug("Card quota on board {}: {}/{}", boardId, current, limit);
        return new CardQuotaDTO(current, limit, !enabled || current < limit, enabled);
    }

    @Override
    public ReactionQuotaDTO getReactionQuota(String boardId, String userHash) {
        requireBoard(boardId);
        Integer limit = boardService.getReactionLimit(boardId);
        long current = reactionRepository.countByBoardAndUser(boardId, userHash);
        boolean enabled = limit != null;

        logger.debug("Reaction quota on board {}: {}/{}", boardId, current, limit);
        return new ReactionQuotaDTO(current, limit, !enabled || current < limit, enabled);
    }

    private void requireBoard(String boardId) {
        if (!boardService.boardExists(boardId)) {
            throw new BoardNotFoundException("Board not found: " + boardId);
        }
    }
}
