package com.bbthechange.retroboard.model;

import com.bbthechange.retroboard.util.RetroKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

import java.util.UUID;

/**
 * One user's vote on one card.
 * Key pattern: PK = CARD#{cardId}, SK = REACTION#{userHash}, so a second vote by the
 * same user addresses the same item.
 */
@DynamoDbBean
public class Reaction extends BaseItem {

    public static final String ITEM_TYPE = "REACTION";

    private String reactionId;
    private String cardId;
    private String boardId;
    private String userHash;
    private String userAlias;
    private ReactionKind reactionType;

    public Reaction() {
        super(ITEM_TYPE);
    }

    public Reaction(String cardId, String boardId, String userHash, String userAlias, ReactionKind reactionType) {
        this();
        this.reactionId = UUID.randomUUID().toString();
        this.cardId = cardId;
        this.boardId = boardId;
        this.userHash = userHash;
        this.userAlias = userAlias;
        this.reactionType = reactionType;

        assignPrimaryKey(RetroKeyFactory.getCardPk(cardId), RetroKeyFactory.getReactionSk(userHash));
        assignBoardUserIndex(RetroKeyFactory.getBoardUserPk(boardId, userHash), RetroKeyFactory.getReactionGsiSk(cardId));
    }

    public String getReactionId() {
        return reactionId;
    }

    public void setReactionId(String reactionId) {
        this.reactionId = reactionId;
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

    public String getUserHash() {
        return userHash;
    }

    public void setUserHash(String userHash) {
        this.userHash = userHash;
    }

    public String getUserAlias() {
        return userAlias;
    }

    public void setUserAlias(String userAlias) {
        this.userAlias = userAlias;
    }

    public ReactionKind getReactionType() {
        return reactionType;
    }

    public void setReactionType(ReactionKind reactionType) {
        this.reactionType = reactionType;
    }
}
