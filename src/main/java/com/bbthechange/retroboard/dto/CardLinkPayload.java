package com.bbthechange.retroboard.dto;

import com.bbthechange.retroboard.model.LinkType;

/**
 * Event payload for card:linked and card:unlinked.
 */
public record CardLinkPayload(String sourceId, String targetId, String boardId, String linkType) {

    public CardLinkPayload(String sourceId, String targetId, String boardId, LinkType linkType) {
        this(sourceId, targetId, boardId, linkType.getWireValue());
    }
}
