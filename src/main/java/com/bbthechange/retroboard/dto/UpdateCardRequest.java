package com.bbthechange.retroboard.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public class UpdateCardRequest {

    @NotBlank(message = "Content is required")
    @Size(max = 5000, message = "Content must be 5000 characters or less")
    private String content;

    public UpdateCardRequest() {}

    public UpdateCardRequest(String content) {
        this.content = content;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }
}
