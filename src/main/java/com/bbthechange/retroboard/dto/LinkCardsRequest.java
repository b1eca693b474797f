package com.bbthechange.retroboard.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Body of link and unlink calls. The link type stays a string until {@code LinkType.fromWire}
 * parses it, so an unknown value surfaces as a VALIDATION_ERROR with a precise message.
 */
public class LinkCardsRequest {

    @NotBlank(message = "Target card ID is required")
    private String targetCardId;

    @NotBlank(message = "Link type is required")
    private String linkType;

    public LinkCardsRequest() {}

    public LinkCardsRequest(String targetCardId, String linkType) {
        this.targetCardId = targetCardId;
        this.linkType = linkType;
    }

    public String getTargetCardId() {
        return targetCardId;
    }

    public void setTargetCardId(String targetCardId) {
        this.targetCardId = targetCardId;
    }

    public String getLinkType() {
        return linkType;
    }

    public void setLinkType(String linkType) {
        this.linkType = linkType;
    }
}
