package com.tradejournal.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Option right of a leg. Serialized as {@code call} / {@code put} to match the
 * journal's leg records.
 */
public enum OptionRight {
    CALL("call", "C", "Call"),
    PUT("put", "P", "Put");

    private final String wireId;
    private final String letter;
    private final String label;

    OptionRight(String wireId, String letter, String label) {
        this.wireId = wireId;
        this.letter = letter;
        this.label = label;
    }

    @JsonValue
    public String getWireId() {
        return wireId;
    }

    /** Single-letter code used in leg notation: C or P. */
    public String getLetter() {
        return letter;
    }

    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static OptionRight fromWireId(String value) {
        if (value == null) {
            return null;
        }
        for (OptionRight right : values()) {
            if (right.wireId.equalsIgnoreCase(value) || right.name().equalsIgnoreCase(value)) {
                return right;
            }
        }
        throw new IllegalArgumentException("Unknown option right: " + value);
    }
}
