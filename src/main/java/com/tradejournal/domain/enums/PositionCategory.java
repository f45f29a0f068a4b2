package com.tradejournal.domain.enums;

/**
 * Grouping used by the position editor's type picker.
 */
public enum PositionCategory {
    BASIC,
    SPREADS,
    VOLATILITY,
    TIME,
    OTHER
}
