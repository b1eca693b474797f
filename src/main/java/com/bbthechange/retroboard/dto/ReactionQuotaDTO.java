package com.bbthechange.retroboard.dto;

/**
 * Reaction quota of one user on one board. {@code limit} is null when the board has none.
 */
public record ReactionQuotaDTO(long currentCount, Integer limit, boolean canReact, boolean limitEnabled) {
}
