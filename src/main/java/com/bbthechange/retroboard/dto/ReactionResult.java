package com.bbthechange.retroboard.dto;

/**
 * Outcome of an add-or-update vote.
 *
 * @param reaction the stored reaction
 * @param created true for a first vote, false when an existing vote was changed in place
 */
public record ReactionResult(ReactionDTO reaction, boolean created) {
}
