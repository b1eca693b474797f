package com.bbthechange.retroboard.testutil;

import com.bbthechange.retroboard.exception.VersionConflictException;
import com.bbthechange.retroboard.model.Board;
import com.bbthechange.retroboard.repository.BoardRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Board store that hands out copies, so services only see changes they persisted.
 */
public class InMemoryBoardRepository implements BoardRepository {

    private final Map<String, Board> boards = new ConcurrentHashMap<>();

    @Override
    public Board save(Board board) {
        boards.put(board.getBoardId(), copy(board));
        return board;
    }

    @Override
    public Optional<Board> findById(String boardId) {
        return Optional.ofNullable(boards.get(boardId)).map(InMemoryBoardRepository::copy);
    }

    @Override
    public synchronized void addAdmin(String boardId, String newAdminHash, String requesterHash) {
        Board stored = boards.get(boardId);
        if (stored == null || !stored.isOpen() || !stored.isAdmin(requesterHash) || stored.isAdmin(newAdminHash)) {
            throw new VersionConflictException("Board changed while adding an admin: " + boardId);
        }
        Board updated = copy(stored);
        updated.getAdmins().add(newAdminHash);
        boards.put(boardId, updated);
    }

    private static Board copy(Board source) {
        Board target = new Board();
        target.setPk(source.getPk());
        target.setSk(source.getSk());
        target.setCreatedAt(source.getCreatedAt());
        target.setUpdatedAt(source.getUpdatedAt());
        target.setBoardId(source.getBoardId());
        target.setName(source.getName());
        target.setColumns(source.getColumns() == null ? null : new ArrayList<>(source.getColumns()));
        target.setState(source.getState());
        target.setCardLimitPerUser(source.getCardLimitPerUser());
        target.setReactionLimitPerUser(source.getReactionLimitPerUser());
        target.setAdmins(source.getAdmins() == null ? new ArrayList<>() : new ArrayList<>(List.copyOf(source.getAdmins())));
        target.setCreatedByHash(source.getCreatedByHash());
        target.setClosedAt(source.getClosedAt());
        return target;
    }
}
