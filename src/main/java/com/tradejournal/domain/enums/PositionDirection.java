package com.tradejournal.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Net direction of a position, derived from the signed quantity of its
 * representative leg. Positive quantity = LONG, negative quantity = SHORT.
 */
public enum PositionDirection {
    LONG("long", "Long", 1),
    SHORT("short", "Short", -1);

    private final String wireId;
    private final String label;
    private final int multiplier;

    PositionDirection(String wireId, String label, int multiplier) {
        this.wireId = wireId;
        this.label = label;
        this.multiplier = multiplier;
    }

    @JsonValue
    public String getWireId() {
        return wireId;
    }

    public String getLabel() {
        return label;
    }

    /** Signed multiplier applied to long-canonical leg ratios: +1 or -1. */
    public int multiplier() {
        return multiplier;
    }

    public PositionDirection opposite() {
        return this == LONG ? SHORT : LONG;
    }

    /** LONG for a positive sign, SHORT otherwise. Zero falls on SHORT. */
    public static PositionDirection fromSign(int signedQuantity) {
        return signedQuantity > 0 ? LONG : SHORT;
    }

    @JsonCreator
    public static PositionDirection fromWireId(String value) {
        if (value == null) {
            return null;
        }
        for (PositionDirection direction : values()) {
            if (direction.wireId.equalsIgnoreCase(value)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown position direction: " + value);
    }
}
