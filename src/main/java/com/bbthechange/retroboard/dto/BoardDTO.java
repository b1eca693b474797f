package com.bbthechange.retroboard.dto;

import com.bbthechange.retroboard.model.Board;
import com.bbthechange.retroboard.model.BoardColumn;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Board as seen by one viewer. Admin hashes stay server side; the viewer only learns
 * whether they are an admin and their own user hash, which an admin needs to promote them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BoardDTO {

    private final String id;
    private final String name;
    private final List<BoardColumn> columns;
    private final String state;
    private final Integer cardLimitPerUser;
    private final Integer reactionLimitPerUser;
    private final boolean admin;
    private final String userHash;
    private final Instant createdAt;
    private final Instant closedAt;

    public BoardDTO(Board board, String viewerHash) {
        this.id = board.getBoardId();
        this.name = board.getName();
        this.columns = board.getColumns();
        this.state = board.getState().name().toLowerCase();
        this.cardLimitPerUser = board.getCardLimitPerUser();
        this.reactionLimitPerUser = board.getReactionLimitPerUser();
        this.admin = board.isAdmin(viewerHash);
        this.userHash = viewerHash;
        this.createdAt = board.getCreatedAt();
        this.closedAt = board.getClosedAt();
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public List<BoardColumn> getColumns() { return columns; }
    public String getState() { return state; }
    public Integer getCardLimitPerUser() { return cardLimitPerUser; }
    public Integer getReactionLimitPerUser() { return reactionLimitPerUser; }
    public boolean isAdmin() { return admin; }
    public String getUserHash() { return userHash; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getClosedAt() { return closedAt; }
}
