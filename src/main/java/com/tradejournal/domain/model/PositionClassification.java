package com.tradejournal.domain.model;

import com.tradejournal.domain.enums.PositionDirection;
import com.tradejournal.domain.enums.PositionType;
import lombok.Builder;
import lombok.Value;

/**
 * Result of classifying a set of legs: the recognized structure, its net
 * direction and whether its wings sit at equal distance from the center strike.
 *
 * <p>This is a derived view. The legs stay authoritative and the classification
 * is recomputed from them whenever they change.
 */
@Value
@Builder
public class PositionClassification {

    private static final PositionClassification UNRECOGNIZED = PositionClassification.builder()
            .type(PositionType.CUSTOM)
            .direction(PositionDirection.LONG)
            .symmetric(true)
            .build();

    PositionType type;
    PositionDirection direction;
    boolean symmetric;

    /** CUSTOM / LONG / symmetric: returned for anything that cannot be matched. */
    public static PositionClassification unrecognized() {
        return UNRECOGNIZED;
    }

    public static PositionClassification of(PositionType type, PositionDirection direction) {
        return new PositionClassification(type, direction, true);
    }

    public static PositionClassification of(PositionType type, PositionDirection direction, boolean symmetric) {
        return new PositionClassification(type, direction, symmetric);
    }

    public boolean isRecognized() {
        return type != PositionType.CUSTOM;
    }
}
