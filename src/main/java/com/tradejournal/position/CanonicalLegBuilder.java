package com.tradejournal.position;

import com.tradejournal.calendar.ExpirationCalendar;
import com.tradejournal.config.PositionProperties;
import com.tradejournal.domain.enums.ExpirationPattern;
import com.tradejournal.domain.enums.OptionRight;
import com.tradejournal.domain.enums.PositionDirection;
import com.tradejournal.domain.enums.PositionType;
import com.tradejournal.domain.model.LegBuildRequest;
import com.tradejournal.domain.model.PositionLeg;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds the canonical legs of a structure from a type and a few anchor parameters.
 * This is the inverse of {@link PositionClassifier}: classifying the built legs
 * yields the requested type.
 *
 * <p>Every type is first laid out in its long form, then the direction multiplier
 * (+1 / -1) is applied to every leg's ratio.
 *
 * <p><b>Long-form layouts (offsets from base strike K, wing width w):</b>
 * <pre>
 *   single       +1 K
 *   vertical     call: +1 K / -1 K+w          put: +1 K-w / -1 K
 *   butterfly    +1 K-w / -2 K / +1 K+w
 *   bwb          +1 K-w / -2 K / +1 K+w'      (w' = upper wing, 2w by default)
 *   condor       +1 K-1.5w / -1 K-0.5w / -1 K+0.5w / +1 K+1.5w
 *   straddle     +1 K call / +1 K put
 *   strangle     +1 K-w put / +1 K+w call
 *   iron fly     +1 K-w put / -1 K put / -1 K call / +1 K+w call
 *   iron condor  +1 K-1.5w put / -1 K-0.5w put / -1 K+0.5w call / +1 K+1.5w call
 *   calendar     -1 K near / +1 K far
 *   diagonal     -1 K near / +1 K+w far
 * </pre>
 *
 * <p>The builder is total. Missing anchors fall back to zero strike and width, CALL
 * and the type's default direction; CUSTOM yields a single long leg as a starting
 * point for manual editing.
 */
@Component
public class CanonicalLegBuilder {

    private static final Logger log = LoggerFactory.getLogger(CanonicalLegBuilder.class);

    private static final BigDecimal HALF = new BigDecimal("0.5");
    private static final BigDecimal ONE_AND_HALF = new BigDecimal("1.5");
    private static final BigDecimal BROKEN_WING_FACTOR = BigDecimal.valueOf(2);

    static final String SHORT_TIME_SPREAD_WARNING =
            "Short %s: sells the far-dated option and buys the near one. Exposed to a volatility "
                    + "collapse in the back month and unlimited risk once the near leg expires.";

    private final ExpirationCalendar expirationCalendar;
    private final PositionProperties positionProperties;

    public CanonicalLegBuilder(ExpirationCalendar expirationCalendar, PositionProperties positionProperties) {
        this.expirationCalendar = expirationCalendar;
        this.positionProperties = positionProperties;
    }

    /**
     * Builds the canonical legs for the given type.
     *
     * @param type       structure to build
     * @param baseStrike anchor strike (center for symmetric structures, long strike for verticals)
     * @param width      wing width
     * @param expiration expiration of every leg (near leg for time spreads)
     * @param right      right for single-right structures; ignored for straddle, strangle and iron types
     * @param direction  LONG or SHORT; null for the type's default
     * @return new legs in ascending strike order, long-form ratios times the direction multiplier
     */
    public List<PositionLeg> build(
            PositionType type,
            BigDecimal baseStrike,
            BigDecimal width,
            LocalDate expiration,
            OptionRight right,
            PositionDirection direction) {
        return build(LegBuildRequest.builder()
                .type(type)
                .baseStrike(baseStrike)
                .width(width)
                .expiration(expiration)
                .right(right)
                .direction(direction)
                .build());
    }

    /**
     * Builds a broken-wing butterfly with independent wing widths. Equal widths
     * produce an ordinary butterfly.
     */
    public List<PositionLeg> buildBrokenWing(
            BigDecimal baseStrike,
            BigDecimal lowerWidth,
            BigDecimal upperWidth,
            LocalDate expiration,
            OptionRight right,
            PositionDirection direction) {
        return build(LegBuildRequest.builder()
                .type(PositionType.BWB)
                .baseStrike(baseStrike)
                .width(lowerWidth)
                .upperWidth(upperWidth != null ? upperWidth : lowerWidth)
                .expiration(expiration)
                .right(right)
                .direction(direction)
                .build());
    }

    public List<PositionLeg> build(LegBuildRequest request) {
        PositionType type = request.getType() != null ? request.getType() : PositionType.CUSTOM;
        PositionDirection direction = resolveDirection(type, request.getDirection());

        List<PositionLeg> longForm = layout(type, request);
        List<PositionLeg> legs = applyDirection(longForm, direction);

        log.debug("Built {} {} legs: base={}, width={}, expiration={}",
                direction, type, request.getBaseStrike(), request.getWidth(), request.getExpiration());
        return legs;
    }

    /** Explicit direction if given, otherwise the type's default. */
    public PositionDirection resolveDirection(PositionType type, PositionDirection direction) {
        if (direction != null) {
            return direction;
        }
        return type != null ? type.getDefaultDirection() : PositionDirection.LONG;
    }

    /**
     * Caller-facing warnings for a type/direction choice. A short calendar or
     * diagonal carries elevated volatility risk and is flagged.
     */
    public List<String> warningsFor(PositionType type, PositionDirection direction) {
        if (type != null && type.isTimeSpread() && resolveDirection(type, direction) == PositionDirection.SHORT) {
            return List.of(String.format(SHORT_TIME_SPREAD_WARNING, type.getLabel().toLowerCase()));
        }
        return List.of();
    }

    /**
     * Rounds a price to the nearest strike on the given grid, half up.
     * Example: roundToIncrement(6012.4, 5) = 6010. A missing or zero increment
     * returns the price unchanged.
     */
    public BigDecimal roundToIncrement(BigDecimal price, BigDecimal increment) {
        if (price == null) {
            return BigDecimal.ZERO;
        }
        if (increment == null || increment.signum() == 0) {
            return price;
        }
        return price.divide(increment, 0, RoundingMode.HALF_UP).multiply(increment);
    }

    // ========================
    // LAYOUT
    // ========================

    private List<PositionLeg> layout(PositionType type, LegBuildRequest request) {
        BigDecimal k = orZero(request.getBaseStrike());
        BigDecimal w = orZero(request.getWidth());
        LocalDate exp = request.getExpiration();
        OptionRight right = request.getRight() != null ? request.getRight() : OptionRight.CALL;

        return switch (type) {
            case SINGLE, CUSTOM -> List.of(leg(k, exp, right, 1));

            case VERTICAL -> right == OptionRight.CALL
                    ? List.of(leg(k, exp, OptionRight.CALL, 1), leg(k.add(w), exp, OptionRight.CALL, -1))
                    : List.of(leg(k.subtract(w), exp, OptionRight.PUT, 1), leg(k, exp, OptionRight.PUT, -1));

            case BUTTERFLY -> butterfly(k, w, w, exp, right);

            case BWB -> {
                BigDecimal upper = request.getUpperWidth() != null
                        ? request.getUpperWidth()
                        : w.multiply(BROKEN_WING_FACTOR);
                yield butterfly(k, w, upper, exp, right);
            }

            case CONDOR -> List.of(
                    leg(k.subtract(w.multiply(ONE_AND_HALF)), exp, right, 1),
                    leg(k.subtract(w.multiply(HALF)), exp, right, -1),
                    leg(k.add(w.multiply(HALF)), exp, right, -1),
                    leg(k.add(w.multiply(ONE_AND_HALF)), exp, right, 1));

            case STRADDLE -> List.of(leg(k, exp, OptionRight.PUT, 1), leg(k, exp, OptionRight.CALL, 1));

            case STRANGLE -> List.of(
                    leg(k.subtract(w), exp, OptionRight.PUT, 1), leg(k.add(w), exp, OptionRight.CALL, 1));

            case IRON_FLY -> List.of(
                    leg(k.subtract(w), exp, OptionRight.PUT, 1),
                    leg(k, exp, OptionRight.PUT, -1),
                    leg(k, exp, OptionRight.CALL, -1),
                    leg(k.add(w), exp, OptionRight.CALL, 1));

            case IRON_CONDOR -> List.of(
                    leg(k.subtract(w.multiply(ONE_AND_HALF)), exp, OptionRight.PUT, 1),
                    leg(k.subtract(w.multiply(HALF)), exp, OptionRight.PUT, -1),
                    leg(k.add(w.multiply(HALF)), exp, OptionRight.CALL, -1),
                    leg(k.add(w.multiply(ONE_AND_HALF)), exp, OptionRight.CALL, 1));

            case CALENDAR, DIAGONAL -> {
                // Sell the near expiration, buy the far one
                LocalDate far = farExpiration(request);
                BigDecimal farStrike = type == PositionType.DIAGONAL ? k.add(w) : k;
                yield List.of(leg(k, exp, right, -1), leg(farStrike, far, right, 1));
            }
        };
    }

    private List<PositionLeg> butterfly(
            BigDecimal k, BigDecimal lowerWidth, BigDecimal upperWidth, LocalDate exp, OptionRight right) {
        return List.of(
                leg(k.subtract(lowerWidth), exp, right, 1),
                leg(k, exp, right, -2),
                leg(k.add(upperWidth), exp, right, 1));
    }

    private LocalDate farExpiration(LegBuildRequest request) {
        if (request.getFarExpiration() != null) {
            return request.getFarExpiration();
        }
        if (request.getExpiration() == null) {
            return null;
        }
        ExpirationPattern pattern = request.getExpirationPattern() != null
                ? request.getExpirationPattern()
                : positionProperties.getDefaultExpirationPattern();
        return expirationCalendar.nextExpiration(request.getExpiration(), pattern);
    }

    private static List<PositionLeg> applyDirection(List<PositionLeg> longForm, PositionDirection direction) {
        List<PositionLeg> legs = new ArrayList<>(longForm.size());
        for (PositionLeg leg : longForm) {
            legs.add(leg.withQuantity(leg.getQuantity() * direction.multiplier()));
        }
        return legs;
    }

    private static PositionLeg leg(BigDecimal strike, LocalDate expiration, OptionRight right, int ratio) {
        return PositionLeg.builder()
                .strike(strike)
                .expiration(expiration)
                .right(right)
                .quantity(ratio)
                .build();
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
