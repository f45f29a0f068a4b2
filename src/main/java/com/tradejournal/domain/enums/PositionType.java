package com.tradejournal.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed taxonomy of multi-leg option structures recognized by the journal.
 *
 * <p>Notation follows the TastyTrade/CBOE convention: the structure is described by
 * the ratio per strike from low to high ({@code 1-2-1} for a butterfly), with the
 * sign giving long or short.
 *
 * <p>CUSTOM is the fallback for anything the classifier cannot positively
 * identify. It is a valid result, never an error.
 */
public enum PositionType {
    SINGLE("single", "Single", "SGL", PositionCategory.BASIC, PositionDirection.LONG),
    VERTICAL("vertical", "Vertical", "VS", PositionCategory.BASIC, PositionDirection.LONG),
    BUTTERFLY("butterfly", "Butterfly", "BF", PositionCategory.SPREADS, PositionDirection.LONG),
    BWB("bwb", "BWB", "BWB", PositionCategory.SPREADS, PositionDirection.LONG),
    CONDOR("condor", "Condor", "CDR", PositionCategory.SPREADS, PositionDirection.LONG),
    STRADDLE("straddle", "Straddle", "STR", PositionCategory.VOLATILITY, PositionDirection.SHORT),
    STRANGLE("strangle", "Strangle", "STRG", PositionCategory.VOLATILITY, PositionDirection.SHORT),
    IRON_FLY("iron_fly", "Iron Fly", "IF", PositionCategory.VOLATILITY, PositionDirection.SHORT),
    IRON_CONDOR("iron_condor", "Iron Condor", "IC", PositionCategory.VOLATILITY, PositionDirection.SHORT),
    CALENDAR("calendar", "Calendar", "CAL", PositionCategory.TIME, PositionDirection.LONG),
    DIAGONAL("diagonal", "Diagonal", "DIAG", PositionCategory.TIME, PositionDirection.LONG),
    CUSTOM("custom", "Custom", "CUST", PositionCategory.OTHER, PositionDirection.LONG);

    private final String wireId;
    private final String label;
    private final String code;
    private final PositionCategory category;
    private final PositionDirection defaultDirection;

    PositionType(
            String wireId,
            String label,
            String code,
            PositionCategory category,
            PositionDirection defaultDirection) {
        this.wireId = wireId;
        this.label = label;
        this.code = code;
        this.category = category;
        this.defaultDirection = defaultDirection;
    }

    @JsonValue
    public String getWireId() {
        return wireId;
    }

    /** Human-readable label, e.g. "Iron Condor". */
    public String getLabel() {
        return label;
    }

    /** Short badge code, e.g. "IC". */
    public String getCode() {
        return code;
    }

    public PositionCategory getCategory() {
        return category;
    }

    /**
     * Direction the editor preselects. Iron structures, straddles and strangles are
     * normally traded for a credit and default to SHORT.
     */
    public PositionDirection getDefaultDirection() {
        return defaultDirection;
    }

    /** Calendar and diagonal: legs on two different expirations. */
    public boolean isTimeSpread() {
        return this == CALENDAR || this == DIAGONAL;
    }

    /** Families whose legs all share one right when built canonically. */
    public boolean isSingleRight() {
        return switch (this) {
            case SINGLE, VERTICAL, BUTTERFLY, BWB, CONDOR, CALENDAR, DIAGONAL -> true;
            default -> false;
        };
    }

    @JsonCreator
    public static PositionType fromWireId(String value) {
        if (value == null) {
            return null;
        }
        for (PositionType type : values()) {
            if (type.wireId.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown position type: " + value);
    }
}
