package com.bbthechange.retroboard.dto;

import com.bbthechange.retroboard.model.CardKind;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for posting a card onto a board.
 */
public class CreateCardRequest {

    @NotBlank(message = "Column ID is required")
    @Size(max = 50, message = "Column ID must be 50 characters or less")
    private String columnId;

    @NotBlank(message = "Content is required")
    @Size(max = 5000, message = "Content must be 5000 characters or less")
    private String content;

    private CardKind cardType = CardKind.FEEDBACK;

    private boolean anonymous = false;

    public CreateCardRequest() {}

    public CreateCardRequest(String columnId, String content, CardKind cardType, boolean anonymous) {
        this.columnId = columnId;
        this.content = content;
        this.cardType = cardType;
        this.anonymous = anonymous;
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
}
