package com.bbthechange.retroboard.model;

import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Follow-up task note. Never part of the hierarchy; may reference feedback cards.
 * Exempt from the card quota.
 */
@DynamoDbBean
public final class ActionCard extends Card {

    private Set<String> linkedFeedbackIds;

    public ActionCard() {
        super();
        setCardType(CardKind.ACTION);
    }

    public ActionCard(String boardId, String columnId, String content,
                      String ownerHash, String alias, boolean anonymous) {
        super(CardKind.ACTION, boardId, columnId, content, ownerHash, alias, anonymous);
    }

    public Set<String> getLinkedFeedbackIds() {
        return linkedFeedbackIds;
    }

    public void setLinkedFeedbackIds(Set<String> linkedFeedbackIds) {
        this.linkedFeedbackIds = linkedFeedbackIds == null || linkedFeedbackIds.isEmpty()
            ? null : new HashSet<>(linkedFeedbackIds);
    }

    @DynamoDbIgnore
    public Set<String> linkedFeedback() {
        return linkedFeedbackIds == null ? Collections.emptySet() : Collections.unmodifiableSet(linkedFeedbackIds);
    }

    @DynamoDbIgnore
    public boolean isLinkedTo(String feedbackCardId) {
        return linkedFeedbackIds != null && linkedFeedbackIds.contains(feedbackCardId);
    }

    @Override
    public String parentId() {
        return null;
    }
}
