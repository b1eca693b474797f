package com.bbthechange.retroboard.service;

import com.bbthechange.retroboard.model.LinkType;

/**
 * Parent/child grouping of feedback cards and action-to-feedback links.
 * Both operations are allowed for the source card's owner and for board admins.
 */
public interface RelationshipService {

    void link(String sourceCardId, String targetCardId, LinkType linkType, String userHash);

    /**
     * Remove a relationship. Unlinking cards that are not linked is a no-op.
     */
    void unlink(String sourceCardId, String targetCardId, LinkType linkType, String userHash);
}
