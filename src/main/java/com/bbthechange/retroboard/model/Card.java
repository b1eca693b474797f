package com.bbthechange.retroboard.model;

import com.bbthechange.retroboard.util.RetroKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;

import java.util.UUID;

/**
 * A note on a board. Closed over {@link FeedbackCard} and {@link ActionCard}; each variant
 * carries only the relationship fields that are legal for it.
 *
 * Key pattern: PK = CARD#{cardId}, SK = METADATA, with the board and board/user indexes
 * populated at construction.
 */
@DynamoDbBean
public abstract sealed class Card extends BaseItem permits FeedbackCard, ActionCard {

    public static final String ITEM_TYPE = "CARD";

    private String cardId;
    private String boardId;
    private String columnId;
    private String content;
    private CardKind cardType;
    private boolean anonymous;
    private String ownerHash;
    private String displayAlias;
    private int directReactionCount;
    private int aggregatedReactionCount;
    private long version;

    protected Card() {
        super(ITEM_TYPE);
    }

    protected Card(CardKind cardType, String boardId, String columnId, String content,
                   String ownerHash, String alias, boolean anonymous) {
        this();
        this.cardId = UUID.randomUUID().toString();
        this.cardType = cardType;
        this.boardId = boardId;
        this.columnId = columnId;
        this.content = content;
        this.ownerHash = ownerHash;
        this.anonymous = anonymous;
        this.displayAlias = anonymous ? null : alias;

        assignPrimaryKey(RetroKeyFactory.getCardPk(cardId), RetroKeyFactory.getMetadataSk());
        assignBoardIndex(RetroKeyFactory.getBoardPk(boardId), RetroKeyFactory.getCardSk(cardId));
        assignBoardUserIndex(RetroKeyFactory.getBoardUserPk(boardId, ownerHash), RetroKeyFactory.getCardSk(cardId));
    }

    public String getCardId() {
        return cardId;
    }

    public void setCardId(String cardId) {
        this.cardId = cardId;
    }

    public String getBoardId() {
        return boardId;
    }

    public void setBoardId(String boardId) {
        this.boardId = boardId;
    }

    public String getColumnId() {
        return columnId;
    }

    public void setColumnId(String columnId) {
        this.columnId = columnId;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public CardKind getCardType() {
        return cardType;
    }

    public void setCardType(CardKind cardType) {
        this.cardType = cardType;
    }

    public boolean isAnonymous() {
        return anonymous;
    }

    public void setAnonymous(boolean anonymous) {
        this.anonymous = anonymous;
    }

    public String getOwnerHash() {
        return ownerHash;
    }

    public void setOwnerHash(String ownerHash) {
        this.ownerHash = ownerHash;
    }

    public String getDisplayAlias() {
        return displayAlias;
    }

    public void setDisplayAlias(String displayAlias) {
        this.displayAlias = displayAlias;
    }

    public int getDirectReactionCount() {
        return directReactionCount;
    }

    public void setDirectReactionCount(int directReactionCount) {
        this.directReactionCount = directReactionCount;
    }

    public int getAggregatedReactionCount() {
        return aggregatedReactionCount;
    }

    public void setAggregatedReactionCount(int aggregatedReactionCount) {
        this.aggregatedReactionCount = aggregatedReactionCount;
    }

    /**
     * Bumped by every write to the card; conditional writes compare against it.
     */
    public long getVersion() {
        return version;
    }

    public void setVersion(long version) {
        this.version = version;
    }

    @DynamoDbIgnore
    public boolean isOwnedBy(String userHash) {
        return ownerHash != null && ownerHash.equals(userHash);
    }

    /**
     * Parent card id for feedback cards, always null for action cards.
     */
    @DynamoDbIgnore
    public abstract String parentId();
}
