package com.tradejournal.position;

import com.tradejournal.domain.enums.OptionRight;
import com.tradejournal.domain.model.PositionLeg;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Strike and expiration measurements derived from a leg set.
 *
 * <p>These are the convenience fields the journal shows next to a position
 * (center strike, wing width, primary expiration). They are computed on demand
 * from the legs and never stored as the source of truth.
 */
@Component
public class PositionGeometry {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    /**
     * Center strike of the structure.
     * <ul>
     *   <li>1 leg: its strike</li>
     *   <li>2 legs: midpoint of the two strikes</li>
     *   <li>3 legs: the middle (body) strike</li>
     *   <li>4 legs: midpoint of the two inner strikes</li>
     * </ul>
     * Zero when no leg has a strike.
     */
    public BigDecimal centerStrike(List<PositionLeg> legs) {
        List<PositionLeg> sorted = LegOrder.strikedByStrike(legs);
        return switch (sorted.size()) {
            case 0 -> BigDecimal.ZERO;
            case 1 -> sorted.get(0).getStrike();
            case 2 -> midpoint(sorted.get(0).getStrike(), sorted.get(1).getStrike());
            case 3 -> sorted.get(1).getStrike();
            case 4 -> midpoint(sorted.get(1).getStrike(), sorted.get(2).getStrike());
            default -> midpoint(
                    sorted.get(0).getStrike(), sorted.get(sorted.size() - 1).getStrike());
        };
    }

    /**
     * Wing width for structures that have one.
     * <ul>
     *   <li>2 legs: strike difference</li>
     *   <li>3 legs: wing width when both wings are equal, empty for a broken wing</li>
     *   <li>4 legs: the lowest gap (outer put wing or lower condor wing)</li>
     * </ul>
     */
    public Optional<BigDecimal> width(List<PositionLeg> legs) {
        List<PositionLeg> sorted = LegOrder.strikedByStrike(legs);
        switch (sorted.size()) {
            case 2:
                return Optional.of(gap(sorted, 0, 1));
            case 3: {
                BigDecimal lower = gap(sorted, 0, 1);
                BigDecimal upper = gap(sorted, 1, 2);
                return lower.compareTo(upper) == 0 ? Optional.of(lower) : Optional.empty();
            }
            case 4:
                return Optional.of(gap(sorted, 0, 1));
            default:
                return Optional.empty();
        }
    }

    /** Earliest expiration across all legs. */
    public Optional<LocalDate> primaryExpiration(List<PositionLeg> legs) {
        return LegOrder.active(legs).stream()
                .map(PositionLeg::getExpiration)
                .filter(Objects::nonNull)
                .min(LocalDate::compareTo);
    }

    /** CALL unless puts outnumber calls. */
    public OptionRight dominantRight(List<PositionLeg> legs) {
        long calls = LegOrder.active(legs).stream()
                .filter(leg -> leg.getRight() == OptionRight.CALL)
                .count();
        long puts = LegOrder.active(legs).stream()
                .filter(leg -> leg.getRight() == OptionRight.PUT)
                .count();
        return calls >= puts ? OptionRight.CALL : OptionRight.PUT;
    }

    public boolean hasSameExpiration(List<PositionLeg> legs) {
        List<PositionLeg> active = LegOrder.active(legs);
        return active.stream().map(PositionLeg::getExpiration).distinct().count() <= 1;
    }

    public boolean hasSameRight(List<PositionLeg> legs) {
        List<PositionLeg> active = LegOrder.active(legs);
        return active.stream().map(PositionLeg::getRight).distinct().count() <= 1;
    }

    static BigDecimal midpoint(BigDecimal a, BigDecimal b) {
        // Halving always terminates, so the exact divide never throws.
        return a.add(b).divide(TWO);
    }

    private static BigDecimal gap(List<PositionLeg> sorted, int lowerIndex, int upperIndex) {
        return sorted.get(upperIndex).getStrike().subtract(sorted.get(lowerIndex).getStrike());
    }
}
