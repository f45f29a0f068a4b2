package com.tradejournal.position;

import com.tradejournal.domain.enums.OptionRight;
import com.tradejournal.domain.model.PositionLeg;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Orderings and filters shared by the classifier, formatter and geometry helpers.
 */
public final class LegOrder {

    /** Strike ascending, then PUT before CALL, then expiration ascending. Nulls last. */
    public static final Comparator<PositionLeg> BY_STRIKE = Comparator.comparing(
                    PositionLeg::getStrike, Comparator.nullsLast(Comparator.<BigDecimal>naturalOrder()))
            .thenComparing(PositionLeg::getRight, Comparator.nullsLast(Comparator.<OptionRight>reverseOrder()))
            .thenComparing(PositionLeg::getExpiration, Comparator.nullsLast(Comparator.<LocalDate>naturalOrder()));

    /** Strike ascending, then expiration ascending. Used for leg notation. */
    public static final Comparator<PositionLeg> BY_STRIKE_THEN_EXPIRATION = Comparator.comparing(
                    PositionLeg::getStrike, Comparator.nullsLast(Comparator.<BigDecimal>naturalOrder()))
            .thenComparing(PositionLeg::getExpiration, Comparator.nullsLast(Comparator.<LocalDate>naturalOrder()))
            .thenComparing(PositionLeg::getRight, Comparator.nullsLast(Comparator.<OptionRight>reverseOrder()));

    private LegOrder() {}

    /**
     * Drops null entries and zero-quantity legs. A zero quantity carries no
     * structure, so it must never influence classification or display.
     */
    public static List<PositionLeg> active(List<PositionLeg> legs) {
        if (legs == null || legs.isEmpty()) {
            return List.of();
        }
        List<PositionLeg> result = new ArrayList<>(legs.size());
        for (PositionLeg leg : legs) {
            if (leg != null && leg.getQuantity() != 0) {
                result.add(leg);
            }
        }
        return result;
    }

    /** Active legs that have a strike, sorted with {@link #BY_STRIKE}. */
    static List<PositionLeg> strikedByStrike(List<PositionLeg> legs) {
        List<PositionLeg> sorted = new ArrayList<>();
        for (PositionLeg leg : active(legs)) {
            if (leg.getStrike() != null) {
                sorted.add(leg);
            }
        }
        sorted.sort(BY_STRIKE);
        return sorted;
    }

    static boolean sameStrike(BigDecimal a, BigDecimal b) {
        return a != null && b != null && a.compareTo(b) == 0;
    }

    static boolean sameExpiration(PositionLeg a, PositionLeg b) {
        return Objects.equals(a.getExpiration(), b.getExpiration());
    }
}
