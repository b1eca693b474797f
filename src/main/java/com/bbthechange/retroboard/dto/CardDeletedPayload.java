package com.bbthechange.retroboard.dto;

public record CardDeletedPayload(String cardId, String boardId) {
}
