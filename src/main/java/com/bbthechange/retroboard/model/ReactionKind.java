package com.bbthechange.retroboard.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Supported reaction types. Only thumbs up today; new kinds are added here.
 */
public enum ReactionKind {
    THUMBS_UP("thumbs_up");

    private final String wireValue;

    ReactionKind(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    @JsonCreator
    public static ReactionKind fromWire(String value) {
        for (ReactionKind kind : values()) {
            if (kind.wireValue.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown reaction type: " + value);
    }
}
