package com.bbthechange.retroboard.model;

import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Feedback note. Can be grouped one level deep: either it has a parent, or it has children,
 * or neither. Counts against the per-user card quota.
 */
@DynamoDbBean
public final class FeedbackCard extends Card {

    private String parentCardId;
    private Set<String> childCardIds;   // null when empty, DynamoDB rejects empty sets

    public FeedbackCard() {
        super();
        setCardType(CardKind.FEEDBACK);
    }

    public FeedbackCard(String boardId, String columnId, String content,
                        String ownerHash, String alias, boolean anonymous) {
        super(CardKind.FEEDBACK, boardId, columnId, content, ownerHash, alias, anonymous);
    }

    public String getParentCardId() {
        return parentCardId;
    }

    public void setParentCardId(String parentCardId) {
        this.parentCardId = parentCardId;
    }

    public Set<String> getChildCardIds() {
        return childCardIds;
    }

    public void setChildCardIds(Set<String> childCardIds) {
        this.childCardIds = childCardIds == null || childCardIds.isEmpty() ? null : new HashSet<>(childCardIds);
    }

    @DynamoDbIgnore
    public Set<String> children() {
        return childCardIds == null ? Collections.emptySet() : Collections.unmodifiableSet(childCardIds);
    }

    @DynamoDbIgnore
    public boolean hasParent() {
        return parentCardId != null;
    }

    @DynamoDbIgnore
    public boolean hasChildren() {
        return childCardIds != null && !childCardIds.isEmpty();
    }

    @Override
    public String parentId() {
        return parentCardId;
    }
}
