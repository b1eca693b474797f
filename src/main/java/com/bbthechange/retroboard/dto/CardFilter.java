package com.bbthechange.retroboard.dto;

/**
 * Optional narrowing for board card listings.
 *
 * @param columnId only cards in this column
 * @param createdBy only cards owned by this user hash
 * @param includeRelationships embed children and linked feedback summaries
 */
public record CardFilter(String columnId, String createdBy, boolean includeRelationships) {

    public static CardFilter all() {
        return new CardFilter(null, null, true);
    }
}
