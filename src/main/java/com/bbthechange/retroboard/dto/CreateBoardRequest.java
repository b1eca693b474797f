package com.bbthechange.retroboard.dto;

import com.bbthechange.retroboard.model.BoardColumn;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request DTO for creating a board.
 */
public class CreateBoardRequest {

    @NotBlank(message = "Board name is required")
    @Size(max = 200, message = "Board name must be 200 characters or less")
    private String name;

    @NotEmpty(message = "At least one column is required")
    @Size(max = 10, message = "A board can have at most 10 columns")
    private List<BoardColumn> columns;

    @Positive(message = "Card limit must be positive")
    private Integer cardLimitPerUser;

    @Positive(message = "Reaction limit must be positive")
    private Integer reactionLimitPerUser;

    public CreateBoardRequest() {}

    public String getName() {
        return name != null ? name.trim() : null;
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
}
