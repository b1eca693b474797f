package com.bbthechange.retroboard.model;

import com.bbthechange.retroboard.util.InstantAsLongAttributeConverter;
import com.bbthechange.retroboard.util.RetroKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Board metadata: columns, open/closed state, per-user limits and admins.
 * Key pattern: PK = BOARD#{boardId}, SK = METADATA
 */
@DynamoDbBean
public class Board extends BaseItem {

    public static final String ITEM_TYPE = "BOARD";

    private String boardId;
    private String name;
    private List<BoardColumn> columns;
    private BoardState state;
    private Integer cardLimitPerUser;       // null = unlimited
    private Integer reactionLimitPerUser;   // null = unlimited
    private List<String> admins;
    private String createdByHash;
    private Instant closedAt;

    public Board() {
        super(ITEM_TYPE);
    }

    public Board(String name, List<BoardColumn> columns, String createdByHash) {
        this();
        this.boardId = UUID.randomUUID().toString();
        this.name = name;
        this.columns = new ArrayList<>(columns);
        this.state = BoardState.ACTIVE;
        this.createdByHash = createdByHash;
        this.admins = new ArrayList<>(List.of(createdByHash));

        assignPrimaryKey(RetroKeyFactory.getBoardPk(boardId), RetroKeyFactory.getMetadataSk());
    }

    public String getBoardId() {
        return boardId;
    }

    public void setBoardId(String boardId) {
        this.boardId = boardId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<BoardColumn> getColumns() {
        return columns;
    }

    public void setColumns(List<BoardColumn> columns) {
        this.columns = columns;
    }

    public BoardState getState() {
        return state;
    }

    public void setState(BoardState state) {
        this.state = state;
    }

    public Integer getCardLimitPerUser() {
        return cardLimitPerUser;
    }

    public void setCardLimitPerUser(Integer cardLimitPerUser) {
        this.cardLimitPerUser = cardLimitPerUser;
    }

    public Integer getReactionLimitPerUser() {
        return reactionLimitPerUser;
    }

    public void setReactionLimitPerUser(Integer reactionLimitPerUser) {
        this.reactionLimitPerUser = reactionLimitPerUser;
    }

    public List<String> getAdmins() {
        return admins;
    }

    public void setAdmins(List<String> admins) {
        this.admins = admins;
    }

    public String getCreatedByHash() {
        return createdByHash;
    }

    public void setCreatedByHash(String createdByHash) {
        this.createdByHash = createdByHash;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getClosedAt() {
        return closedAt;
    }

    public void setClosedAt(Instant closedAt) {
        this.closedAt = closedAt;
    }

    @DynamoDbIgnore
    public boolean isOpen() {
        return state == BoardState.ACTIVE;
    }

    @DynamoDbIgnore
    public boolean hasColumn(String columnId) {
        return columns != null && columns.stream().anyMatch(c -> c.getId().equals(columnId));
    }

    @DynamoDbIgnore
    public boolean isAdmin(String userHash) {
        return admins != null && admins.contains(userHash);
    }
}
