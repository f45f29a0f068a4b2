package com.tradejournal.position;

import com.tradejournal.domain.enums.OptionRight;
import com.tradejournal.domain.enums.PositionDirection;
import com.tradejournal.domain.enums.PositionType;
import com.tradejournal.domain.model.PositionLeg;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Renders legs and classifications as the strings shown in the position editor
 * preview and the journal list.
 *
 * <p>Leg notation: {@code <signed quantity> <C|P> <strike>}, e.g. {@code +1 C 5980},
 * one token per leg joined by {@code " / "}.
 */
@Component
public class PositionFormatter {

    static final String LEG_SEPARATOR = " / ";

    private static final DateTimeFormatter MONTH_DAY = DateTimeFormatter.ofPattern("MMM d", Locale.US);
    private static final DateTimeFormatter MONTH_DAY_YEAR = DateTimeFormatter.ofPattern("MMM d ''yy", Locale.US);

    /**
     * Formats a single leg, e.g. "+1 C 5980" or "-2 P 6000".
     * Missing fields render as "?".
     */
    public String formatLeg(PositionLeg leg) {
        String sign = leg.getQuantity() > 0 ? "+" : "";
        String right = leg.getRight() != null ? leg.getRight().getLetter() : "?";
        return sign + leg.getQuantity() + " " + right + " " + formatStrike(leg.getStrike());
    }

    /**
     * Formats all legs as a compact notation string ordered by strike ascending,
     * ties by expiration ascending. Example: "+1 C 5980 / -2 C 6000 / +1 C 6020".
     * Null and zero-quantity legs are skipped; no legs gives "".
     */
    public String formatLegsDisplay(List<PositionLeg> legs) {
        List<PositionLeg> sorted = new ArrayList<>(LegOrder.active(legs));
        sorted.sort(LegOrder.BY_STRIKE_THEN_EXPIRATION);
        return sorted.stream().map(this::formatLeg).collect(Collectors.joining(LEG_SEPARATOR));
    }

    /**
     * Formats the position label, e.g. "Short Iron Condor".
     *
     * <p>Unrecognized structures (null or CUSTOM type) are labelled "Custom". When no
     * direction is supplied it is taken from the sign of the legs' net quantity.
     */
    public String formatPositionLabel(PositionType type, PositionDirection direction, List<PositionLeg> legs) {
        if (type == null || type == PositionType.CUSTOM) {
            return PositionType.CUSTOM.getLabel();
        }
        return directionOrNet(direction, legs).getLabel() + " " + type.getLabel();
    }

    /**
     * Label with the option right for single-right structures, e.g.
     * "Long Call Butterfly" or "Short Put Vertical". Falls back to
     * {@link #formatPositionLabel} when legs mix rights or the type always does.
     */
    public String formatSidedLabel(PositionType type, PositionDirection direction, List<PositionLeg> legs) {
        String label = formatPositionLabel(type, direction, legs);
        if (type == null || !type.isSingleRight()) {
            return label;
        }
        List<PositionLeg> active = LegOrder.active(legs);
        if (active.isEmpty()) {
            return label;
        }
        OptionRight right = active.get(0).getRight();
        boolean oneRight = right != null && active.stream().allMatch(leg -> leg.getRight() == right);
        if (!oneRight) {
            return label;
        }
        return directionOrNet(direction, legs).getLabel() + " " + right.getLabel() + " " + type.getLabel();
    }

    /** Short badge code for a type, "CUST" when unknown. */
    public String typeCode(PositionType type) {
        return type != null ? type.getCode() : PositionType.CUSTOM.getCode();
    }

    /** "Jan 17", or "Jan 17 '25" with the year. Empty for a missing date. */
    public String formatExpiration(LocalDate expiration, boolean includeYear) {
        if (expiration == null) {
            return "";
        }
        return (includeYear ? MONTH_DAY_YEAR : MONTH_DAY).format(expiration);
    }

    /** Plain strike without trailing zeros: 6000, 5987.5. */
    public String formatStrike(BigDecimal strike) {
        if (strike == null) {
            return "?";
        }
        BigDecimal stripped = strike.stripTrailingZeros();
        if (stripped.scale() < 0) {
            stripped = stripped.setScale(0);
        }
        return stripped.toPlainString();
    }

    private static PositionDirection directionOrNet(PositionDirection direction, List<PositionLeg> legs) {
        if (direction != null) {
            return direction;
        }
        int net = LegOrder.active(legs).stream().mapToInt(PositionLeg::getQuantity).sum();
        return net >= 0 ? PositionDirection.LONG : PositionDirection.SHORT;
    }
}
