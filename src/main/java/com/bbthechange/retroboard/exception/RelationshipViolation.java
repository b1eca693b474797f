package com.bbthechange.retroboard.exception;

/**
 * Which relationship rule a rejected link would have broken.
 */
public enum RelationshipViolation {
    /** Source and target are the same card, or the target is already the source's parent. */
    CIRCULAR_RELATIONSHIP,
    /** The source already has a parent and so cannot take children. */
    CHILD_CANNOT_BE_PARENT,
    /** The target already has children and so cannot take a parent. */
    PARENT_CANNOT_BE_CHILD,
    /** The card kinds do not fit the link type. */
    INVALID_CARD_TYPE,
    /** The cards belong to different boards. */
    CROSS_BOARD
}
