package com.bbthechange.retroboard.dto;

/**
 * Feedback-card quota of one user on one board. {@code limit} is null when the board has none.
 */
public record CardQuotaDTO(long currentCount, Integer limit, boolean canCreate, boolean limitEnabled) {
}
