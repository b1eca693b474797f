package com.bbthechange.retroboard.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The two card variants. Stored by name, serialized in lower case on the wire.
 */
public enum CardKind {
    FEEDBACK,
    ACTION;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static CardKind fromWire(String value) {
        if (value == null) {
            return null;
        }
        for (CardKind kind : values()) {
            if (kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown card type: " + value);
    }
}
