package com.bbthechange.retroboard.model;

import com.bbthechange.retroboard.exception.ValidationException;

/**
 * Relationship kinds between two cards.
 * PARENT_OF groups feedback cards one level deep; LINKED_TO points an action card at feedback.
 */
public enum LinkType {
    PARENT_OF("parent_of"),
    LINKED_TO("linked_to");

    private final String wireValue;

    LinkType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }

    public static LinkType fromWire(String value) {
        for (LinkType type : values()) {
            if (type.wireValue.equals(value)) {
                return type;
            }
        }
        throw new ValidationException("INVALID_LINK_TYPE", "Unknown link type: " + value);
    }
}
