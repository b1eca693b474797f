package com.bbthechange.retroboard.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public class MoveCardRequest {

    @NotBlank(message = "Column ID is required")
    @Size(max = 50, message = "Column ID must be 50 characters or less")
    private String columnId;

    public MoveCardRequest() {}

    public MoveCardRequest(String columnId) {
        this.columnId = columnId;
    }

    public String getColumnId() {
        return columnId;
    }

    public void setColumnId(String columnId) {
        this.columnId = columnId;
    }
}
