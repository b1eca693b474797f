package com.bbthechange.retroboard.service.impl;

import com.bbthechange.retroboard.config.CardEngineProperties;
import com.bbthechange.retroboard.dto.BoardDTO;
import com.bbthechange.retroboard.dto.CreateBoardRequest;
import com.bbthechange.retroboard.exception.BoardClosedException;
import com.bbthechange.retroboard.exception.BoardNotFoundException;
import com.bbthechange.retroboard.exception.UnauthorizedException;
import com.bbthechange.retroboard.exception.ValidationException;
import com.bbthechange.retroboard.model.Board;
import com.bbthechange.retroboard.model.BoardColumn;
import com.bbthechange.retroboard.model.BoardState;
import com.bbthechange.retroboard.repository.BoardRepository;
import com.bbthechange.retroboard.service.BoardService;
import com.bbthechange.retroboard.util.ConflictRetrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Service
public class BoardServiceImpl implements BoardService {

    private static final Logger logger = LoggerFactory.getLogger(BoardServiceImpl.class);

    private final BoardRepository boardRepository;
    private final CardEngineProperties properties;
    private final ConflictRetrier conflictRetrier;

    @Autowired
    public BoardServiceImpl(BoardRepository boardRepository, CardEngineProperties properties,
                            ConflictRetrier conflictRetrier) {
        this.boardRepository = boardRepository;
        this.properties = properties;
        this.conflictRetrier = conflictRetrier;
    }

    @Override
    public BoardDTO createBoard(CreateBoardRequest request, String userHash) {
        Set<String> columnIds = new HashSet<>();
        for (BoardColumn column : request.getColumns()) {
            if (column.getId() == null || column.getId().isBlank()
                    || column.getId().length() > properties.getMaxColumnIdLength()) {
                throw new ValidationException("Invalid column ID: " + column.getId());
            }
            if (column.getName() == null || column.getName().isBlank()) {
                throw new ValidationException("Column name is required for column " + column.getId());
            }
            if (!columnIds.add(column.getId())) {
                throw new ValidationException("Duplicate column ID: " + column.getId());
            }
        }

        Board board = new Board(request.getName(), request.getColumns(), userHash);
        board.setCardLimitPerUser(request.getCardLimitPerUser());
        board.setReactionLimitPerUser(request.getReactionLimitPerUser());
        boardRepository.save(board);

        logger.info("Created board {} with {} columns", board.getBoardId(), board.getColumns().size());
        return new BoardDTO(board, userHash);
    }

    @Override
    public BoardDTO getBoard(String boardId, String userHash) {
        return new BoardDTO(requireBoard(boardId), userHash);
    }

    @Override
    public BoardDTO closeBoard(String boardId, String userHash) {
        Board board = requireBoard(boardId);
        if (!board.isAdmin(userHash)) {
            throw new UnauthorizedException("Only board admins can close the board");
        }
        if (board.getState() == BoardState.CLOSED) {
            return new BoardDTO(board, userHash);
        }

        board.setState(BoardState.CLOSED);
        board.setClosedAt(Instant.now());
        boardRepository.save(board);

        logger.info("Closed board {}", boardId);
        return new BoardDTO(board, userHash);
    }

    @Override
    public BoardDTO addAdmin(String boardId, String newAdminHash, String requesterHash) {
        return conflictRetrier.execute("add board admin", () -> {
            Board board = requireBoard(boardId);
            if (!board.isAdmin(requesterHash)) {
                throw new UnauthorizedException("Only board admins can add admins");
            }
            if (!board.isOpen()) {
                throw new BoardClosedException(boardId);
            }
            if (board.isAdmin(newAdminHash)) {
                return new BoardDTO(board, requesterHash);
            }

            boardRepository.addAdmin(boardId, newAdminHash, requesterHash);
            List<String> admins = new ArrayList<>(board.getAdmins());
            admins.add(newAdminHash);
            board.setAdmins(admins);
            logger.info("Board {} now has {} admins", boardId, board.getAdmins().size());
            return new BoardDTO(board, requesterHash);
        });
    }

    @Override
    public boolean boardExists(String boardId) {
        return boardRepository.findById(boardId).isPresent();
    }

    @Override
    public boolean isOpen(String boardId) {
        return requireBoard(boardId).isOpen();
    }

    @Override
    public boolean columnExists(String boardId, String columnId) {
        return requireBoard(boardId).hasColumn(columnId);
    }

    @Override
    public Integer getCardLimit(String boardId) {
        return requireBoard(boardId).getCardLimitPerUser();
    }

    @Override
    public Integer getReactionLimit(String boardId) {
        return requireBoard(boardId).getReactionLimitPerUser();
    }

    @Override
    public boolean isAdmin(String boardId, String userHash) {
        return requireBoard(boardId).isAdmin(userHash);
    }

    private Board requireBoard(String boardId) {
        return boardRepository.findById(boardId)
            .orElseThrow(() -> new BoardNotFoundException("Board not found: " + boardId));
    }
}
