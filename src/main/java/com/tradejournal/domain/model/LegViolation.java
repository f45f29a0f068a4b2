package com.tradejournal.domain.model;

import lombok.Value;

/**
 * One failed field check on a leg, e.g. {@code legs[2].strike: must be greater than 0}.
 * A leg index of -1 marks a violation on the leg list itself.
 */
@Value
public class LegViolation {

    int legIndex;
    String field;
    String message;

    public String getPath() {
        return legIndex < 0 ? field : "legs[" + legIndex + "]." + field;
    }
}
