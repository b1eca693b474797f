package com.bbthechange.retroboard.dto;

/**
 * Summary of a feedback card embedded in the action card that links to it.
 */
public record LinkedFeedbackDTO(String id, String content, String createdByAlias) {
}
