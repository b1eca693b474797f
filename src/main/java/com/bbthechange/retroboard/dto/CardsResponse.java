package com.bbthechange.retroboard.dto;

import java.util.List;
import java.util.Map;

/**
 * Board listing: top-level cards with relationships embedded, plus counts over every
 * matching card (children included).
 */
public record CardsResponse(List<CardDTO> cards, int totalCount, Map<String, Integer> cardsByColumn) {
}
