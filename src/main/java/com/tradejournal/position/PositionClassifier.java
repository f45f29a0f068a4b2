package com.tradejournal.position;

import com.tradejournal.domain.enums.OptionRight;
import com.tradejournal.domain.enums.PositionDirection;
import com.tradejournal.domain.enums.PositionType;
import com.tradejournal.domain.model.PositionClassification;
import com.tradejournal.domain.model.PositionLeg;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Recognizes the structure of a leg set: which {@link PositionType} it is, whether
 * it is held long or short, and whether its wings are symmetric.
 *
 * <p>Detection runs as an ordered set of pattern tests on the active legs (nulls and
 * zero quantities removed), sorted by strike with quantities reduced to their
 * smallest ratio:
 * <ul>
 *   <li>1 leg: single</li>
 *   <li>2 legs, same right, same expiration, different strikes: vertical</li>
 *   <li>2 legs, same right, different expirations: calendar (same strike)
 *       or diagonal (different strikes)</li>
 *   <li>2 legs, call + put, same expiration, equal size: straddle (same strike)
 *       or strangle (different strikes)</li>
 *   <li>3 legs, same right, same expiration, 1-2-1: butterfly (equal wings) or bwb</li>
 *   <li>4 legs, same right, same expiration, 1-1-1-1 with short body: condor</li>
 *   <li>4 legs, put spread below call spread, inner legs opposite to outer legs:
 *       iron fly (inner strikes equal) or iron condor</li>
 *   <li>anything else: custom</li>
 * </ul>
 *
 * <p>The classifier runs on every edit of a partially filled form, so it is total:
 * it never throws and falls back to CUSTOM / LONG / symmetric for anything it cannot
 * match, including an empty list and legs with missing fields.
 */
@Component
public class PositionClassifier {

    private static final Logger log = LoggerFactory.getLogger(PositionClassifier.class);

    /** Largest leg count any named structure uses. */
    static final int MAX_LEGS = 4;

    private final RatioNormalizer ratioNormalizer;

    public PositionClassifier(RatioNormalizer ratioNormalizer) {
        this.ratioNormalizer = ratioNormalizer;
    }

    /**
     * Classifies the given legs.
     *
     * @param legs legs in any order; may be null, empty or partially filled
     * @return the recognized structure, or {@link PositionClassification#unrecognized()}
     */
    public PositionClassification classify(List<PositionLeg> legs) {
        List<PositionLeg> active = LegOrder.active(legs);
        if (active.isEmpty() || active.size() > MAX_LEGS) {
            return PositionClassification.unrecognized();
        }
        if (!active.stream().allMatch(PositionLeg::isComplete)) {
            log.debug("Incomplete leg in {} legs, classifying as custom", active.size());
            return PositionClassification.unrecognized();
        }

        try {
            List<PositionLeg> sorted = new ArrayList<>(active);
            sorted.sort(LegOrder.BY_STRIKE);
            int[] ratios = ratioNormalizer.normalize(
                    sorted.stream().mapToInt(PositionLeg::getQuantity).toArray());

            PositionClassification result = dispatch(sorted, ratios);
            log.debug("Classified {} legs as {} {} (symmetric={})",
                    sorted.size(), result.getDirection(), result.getType(), result.isSymmetric());
            return result;
        } catch (RuntimeException e) {
            log.warn("Leg classification failed, falling back to custom: {}", e.getMessage(), e);
            return PositionClassification.unrecognized();
        }
    }

    private PositionClassification dispatch(List<PositionLeg> sorted, int[] ratios) {
        return switch (sorted.size()) {
            case 1 -> PositionClassification.of(PositionType.SINGLE, PositionDirection.fromSign(ratios[0]));
            case 2 -> classifyTwoLegs(sorted, ratios);
            case 3 -> classifyThreeLegs(sorted, ratios);
            case 4 -> classifyFourLegs(sorted, ratios);
            default -> PositionClassification.unrecognized();
        };
    }

    // ========================
    // 2 LEGS
    // ========================

    private PositionClassification classifyTwoLegs(List<PositionLeg> sorted, int[] ratios) {
        PositionLeg lower = sorted.get(0);
        PositionLeg upper = sorted.get(1);
        boolean sameStrike = LegOrder.sameStrike(lower.getStrike(), upper.getStrike());
        boolean sameExpiration = LegOrder.sameExpiration(lower, upper);

        if (lower.getRight() == upper.getRight()) {
            if (sameExpiration) {
                // Same contract twice has no shape
                if (sameStrike) {
                    return PositionClassification.unrecognized();
                }
                return PositionClassification.of(PositionType.VERTICAL, PositionDirection.fromSign(ratios[0]));
            }
            // Time spread: direction follows the far-dated leg
            int farIndex = lower.getExpiration().isAfter(upper.getExpiration()) ? 0 : 1;
            PositionType type = sameStrike ? PositionType.CALENDAR : PositionType.DIAGONAL;
            return PositionClassification.of(type, PositionDirection.fromSign(ratios[farIndex]));
        }

        // Call + put on one expiration in equal size. A +1/-2 pair is not a straddle.
        if (!sameExpiration || Math.abs(ratios[0]) != Math.abs(ratios[1])) {
            return PositionClassification.unrecognized();
        }
        // Direction from the put (same strike) or the lower strike
        PositionType type = sameStrike ? PositionType.STRADDLE : PositionType.STRANGLE;
        return PositionClassification.of(type, PositionDirection.fromSign(ratios[0]));
    }

    // ========================
    // 3 LEGS
    // ========================

    private PositionClassification classifyThreeLegs(List<PositionLeg> sorted, int[] ratios) {
        if (!singleRight(sorted) || !singleExpiration(sorted) || !strictlyAscending(sorted)) {
            return PositionClassification.unrecognized();
        }
        // 1-2-1: wings share a sign, body is twice the wing with the opposite sign
        boolean butterflyRatios = isUnit(ratios[0]) && ratios[2] == ratios[0] && ratios[1] == -2 * ratios[0];
        if (!butterflyRatios) {
            return PositionClassification.unrecognized();
        }

        BigDecimal center = sorted.get(1).getStrike();
        boolean symmetric = equalOffsets(sorted.get(0).getStrike(), center, sorted.get(2).getStrike());
        PositionType type = symmetric ? PositionType.BUTTERFLY : PositionType.BWB;
        return PositionClassification.of(type, PositionDirection.fromSign(ratios[0]), symmetric);
    }

    // ========================
    // 4 LEGS
    // ========================

    private PositionClassification classifyFourLegs(List<PositionLeg> sorted, int[] ratios) {
        if (!singleExpiration(sorted)) {
            return PositionClassification.unrecognized();
        }
        for (int ratio : ratios) {
            if (!isUnit(ratio)) {
                return PositionClassification.unrecognized();
            }
        }
        return singleRight(sorted) ? classifyCondor(sorted, ratios) : classifyIron(sorted, ratios);
    }

    private PositionClassification classifyCondor(List<PositionLeg> sorted, int[] ratios) {
        if (!strictlyAscending(sorted)) {
            return PositionClassification.unrecognized();
        }
        // Outer wings share a sign, inner body shares the opposite sign
        boolean condorRatios = ratios[3] == ratios[0] && ratios[1] == -ratios[0] && ratios[2] == ratios[1];
        if (!condorRatios) {
            return PositionClassification.unrecognized();
        }

        BigDecimal center = PositionGeometry.midpoint(sorted.get(1).getStrike(), sorted.get(2).getStrike());
        boolean symmetric = equalOffsets(sorted.get(0).getStrike(), center, sorted.get(3).getStrike());
        return PositionClassification.of(PositionType.CONDOR, PositionDirection.fromSign(ratios[0]), symmetric);
    }

    private PositionClassification classifyIron(List<PositionLeg> sorted, int[] ratios) {
        List<Integer> puts = new ArrayList<>(2);
        List<Integer> calls = new ArrayList<>(2);
        for (int i = 0; i < sorted.size(); i++) {
            (sorted.get(i).getRight() == OptionRight.PUT ? puts : calls).add(i);
        }
        if (puts.size() != 2 || calls.size() != 2) {
            return PositionClassification.unrecognized();
        }

        // Indices are in strike order, so the first of each pair is the lower strike
        PositionLeg putWing = sorted.get(puts.get(0));
        PositionLeg putBody = sorted.get(puts.get(1));
        PositionLeg callBody = sorted.get(calls.get(0));
        PositionLeg callWing = sorted.get(calls.get(1));

        boolean distinctWings = putWing.getStrike().compareTo(putBody.getStrike()) < 0
                && callBody.getStrike().compareTo(callWing.getStrike()) < 0;
        // Put spread must sit at or below the call spread
        boolean ordered = putBody.getStrike().compareTo(callBody.getStrike()) <= 0;
        if (!distinctWings || !ordered) {
            return PositionClassification.unrecognized();
        }

        int wingRatio = ratios[puts.get(0)];
        int bodyRatio = ratios[puts.get(1)];
        boolean ironRatios = ratios[calls.get(0)] == bodyRatio
                && ratios[calls.get(1)] == wingRatio
                && bodyRatio == -wingRatio;
        if (!ironRatios) {
            return PositionClassification.unrecognized();
        }

        boolean sharedBody = LegOrder.sameStrike(putBody.getStrike(), callBody.getStrike());
        BigDecimal center = PositionGeometry.midpoint(putBody.getStrike(), callBody.getStrike());
        boolean symmetric = equalOffsets(putWing.getStrike(), center, callWing.getStrike());
        PositionType type = sharedBody ? PositionType.IRON_FLY : PositionType.IRON_CONDOR;
        return PositionClassification.of(type, PositionDirection.fromSign(wingRatio), symmetric);
    }

    // ========================
    // HELPERS
    // ========================

    private static boolean isUnit(int ratio) {
        return ratio == 1 || ratio == -1;
    }

    private static boolean singleRight(List<PositionLeg> legs) {
        OptionRight first = legs.get(0).getRight();
        return legs.stream().allMatch(leg -> leg.getRight() == first);
    }

    private static boolean singleExpiration(List<PositionLeg> legs) {
        PositionLeg first = legs.get(0);
        return legs.stream().allMatch(leg -> LegOrder.sameExpiration(first, leg));
    }

    private static boolean strictlyAscending(List<PositionLeg> sorted) {
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i - 1).getStrike().compareTo(sorted.get(i).getStrike()) >= 0) {
                return false;
            }
        }
        return true;
    }

    /** |center - low| == |high - center| */
    private static boolean equalOffsets(BigDecimal low, BigDecimal center, BigDecimal high) {
        BigDecimal lowerOffset = center.subtract(low).abs();
        BigDecimal upperOffset = high.subtract(center).abs();
        return lowerOffset.compareTo(upperOffset) == 0;
    }
}
