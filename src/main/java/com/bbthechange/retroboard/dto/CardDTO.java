package com.bbthechange.retroboard.dto;

import com.bbthechange.retroboard.model.ActionCard;
import com.bbthechange.retroboard.model.Card;
import com.bbthechange.retroboard.model.CardKind;
import com.bbthechange.retroboard.model.FeedbackCard;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Public view of a card. The owner hash is never part of it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CardDTO {

    private String id;
    private String boardId;
    private String columnId;
    private String content;
    private CardKind cardType;
    private boolean anonymous;
    private String createdByAlias;
    private Instant createdAt;
    private Instant updatedAt;
    private int directReactionCount;
    private int aggregatedReactionCount;
    private String parentCardId;
    private Set<String> linkedFeedbackIds;
    private List<CardDTO> children;
    private List<LinkedFeedbackDTO> linkedFeedbackCards;

    public CardDTO() {}

    public CardDTO(Card card) {
        this.id = card.getCardId();
        this.boardId = card.getBoardId();
        this.columnId = card.getColumnId();
        this.content = card.getContent();
        this.cardType = card.getCardType();
        this.anonymous = card.isAnonymous();
        this.createdByAlias = card.isAnonymous() ? null : card.getDisplayAlias();
        this.createdAt = card.getCreatedAt();
        this.updatedAt = card.getUpdatedAt();
        this.directReactionCount = card.getDirectReactionCount();
        this.aggregatedReactionCount = card.getAggregatedReactionCount();
        if (card instanceof FeedbackCard feedback) {
            this.parentCardId = feedback.getParentCardId();
        } else if (card instanceof ActionCard action) {
            this.linkedFeedbackIds = new TreeSet<>(action.linkedFeedback());
        }
    }

    /** Drop linked ids whose feedback card is no longer on the board. */
    public void retainLinkedFeedback(Set<String> boardCardIds) {
        if (linkedFeedbackIds != null) {
            linkedFeedbackIds.retainAll(boardCardIds);
        }
    }

    public void addChild(CardDTO child) {
        if (children == null) {
            children = new ArrayList<>();
        }
        children.add(child);
    }

    public void addLinkedFeedbackCard(LinkedFeedbackDTO linked) {
        if (linkedFeedbackCards == null) {
            linkedFeedbackCards = new ArrayList<>();
        }
        linkedFeedbackCards.add(linked);
    }

    public String getId() { return id; }
    public String getBoardId() { return boardId; }
    public String getColumnId() { return columnId; }
    public String getContent() { return content; }
    public CardKind getCardType() { return cardType; }
    public boolean isAnonymous() { return anonymous; }
    public String getCreatedByAlias() { return createdByAlias; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public int getDirectReactionCount() { return directReactionCount; }
    public int getAggregatedReactionCount() { return aggregatedReactionCount; }
    public String getParentCardId() { return parentCardId; }
    public Set<String> getLinkedFeedbackIds() { return linkedFeedbackIds; }
    public List<CardDTO> getChildren() { return children; }
    public List<LinkedFeedbackDTO> getLinkedFeedbackCards() { return linkedFeedbackCards; }
}
