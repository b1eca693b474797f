package com.bbthechange.retroboard.model;

import com.bbthechange.retroboard.util.InstantAsLongAttributeConverter;
import com.bbthechange.retroboard.util.RetroKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.*;

import java.time.Instant;

/**
 * Key attributes, type discriminator and audit timestamps shared by boards, cards and reactions
 * in the RetroBoardTable.
 * <p>
 * Index layout:
 * <ul>
 *   <li>BoardIndex (gsi1): {@code BOARD#id} / {@code CARD#id}, every card on a board</li>
 *   <li>BoardUserIndex (gsi2): {@code BOARD#id#USER#hash} / {@code CARD#id} or {@code REACTION#cardId},
 *       what one user created or reacted to on a board</li>
 * </ul>
 */
@DynamoDbBean
public abstract class BaseItem {

    private String pk;
    private String sk;
    private String gsi1pk;
    private String gsi1sk;
    private String gsi2pk;
    private String gsi2sk;
    private String itemType;
    private Instant createdAt;
    private Instant updatedAt;

    protected BaseItem(String itemType) {
        Instant now = Instant.now();
        this.itemType = itemType;
        this.createdAt = now;
        this.updatedAt = now;
    }

    protected void assignPrimaryKey(String pk, String sk) {
        this.pk = pk;
        this.sk = sk;
    }

    protected void assignBoardIndex(String boardPk, String itemSk) {
        this.gsi1pk = boardPk;
        this.gsi1sk = itemSk;
    }

    protected void assignBoardUserIndex(String boardUserPk, String itemSk) {
        this.gsi2pk = boardUserPk;
        this.gsi2sk = itemSk;
    }

    @DynamoDbPartitionKey
    public String getPk() {
        return pk;
    }

    public void setPk(String pk) {
        this.pk = pk;
    }

    @DynamoDbSortKey
    public String getSk() {
        return sk;
    }

    public void setSk(String sk) {
        this.sk = sk;
    }

    @DynamoDbSecondaryPartitionKey(indexNames = RetroKeyFactory.BOARD_INDEX)
    public String getGsi1pk() {
        return gsi1pk;
    }

    public void setGsi1pk(String gsi1pk) {
        this.gsi1pk = gsi1pk;
    }

    @DynamoDbSecondarySortKey(indexNames = RetroKeyFactory.BOARD_INDEX)
    public String getGsi1sk() {
        return gsi1sk;
    }

    public void setGsi1sk(String gsi1sk) {
        this.gsi1sk = gsi1sk;
    }

    @DynamoDbSecondaryPartitionKey(indexNames = RetroKeyFactory.BOARD_USER_INDEX)
    public String getGsi2pk() {
        return gsi2pk;
    }

    public void setGsi2pk(String gsi2pk) {
        this.gsi2pk = gsi2pk;
    }

    @DynamoDbSecondarySortKey(indexNames = RetroKeyFactory.BOARD_USER_INDEX)
    public String getGsi2sk() {
        return gsi2sk;
    }

    public void setGsi2sk(String gsi2sk) {
        this.gsi2sk = gsi2sk;
    }

    @DynamoDbAttribute("itemType")
    public String getItemType() {
        return itemType;
    }

    public void setItemType(String itemType) {
        this.itemType = itemType;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public void touch() {
        this.updatedAt = Instant.now();
    }
}
