package com.tradejournal.position;

import com.tradejournal.config.PositionProperties;
import com.tradejournal.domain.enums.PositionType;
import com.tradejournal.domain.model.PositionClassification;
import com.tradejournal.domain.model.PositionLeg;
import com.tradejournal.domain.model.PositionSummary;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Assembles the display view of a position from its legs: classification,
 * labels, notation and the derived strike/expiration fields.
 *
 * <p>Every field is recomputed from the legs on each call; nothing is cached, so
 * the summary always matches the current editor state.
 */
@Service
public class PositionSummaryService {

    private final PositionClassifier positionClassifier;
    private final PositionFormatter positionFormatter;
    private final PositionGeometry positionGeometry;
    private final PositionProperties positionProperties;

    public PositionSummaryService(
            PositionClassifier positionClassifier,
            PositionFormatter positionFormatter,
            PositionGeometry positionGeometry,
            PositionProperties positionProperties) {
        this.positionClassifier = positionClassifier;
        this.positionFormatter = positionFormatter;
        this.positionGeometry = positionGeometry;
        this.positionProperties = positionProperties;
    }

    /** Summarizes the legs as of today in the journal time zone. */
    public PositionSummary summarize(String symbol, List<PositionLeg> legs) {
        return summarize(symbol, legs, LocalDate.now(ZoneId.of(positionProperties.getTimeZone())));
    }

    /** Summarizes the legs with days to expiration counted from {@code today}. */
    public PositionSummary summarize(String symbol, List<PositionLeg> legs, LocalDate today) {
        List<PositionLeg> safeLegs = legs != null ? legs : List.of();
        PositionClassification classification = positionClassifier.classify(safeLegs);
        PositionType type = classification.getType();
        LocalDate primaryExpiration =
                positionGeometry.primaryExpiration(safeLegs).orElse(null);

        return PositionSummary.builder()
                .symbol(symbol)
                .positionType(type)
                .direction(classification.getDirection())
                .symmetric(classification.isSymmetric())
                .label(positionFormatter.formatPositionLabel(type, classification.getDirection(), safeLegs))
                .sidedLabel(positionFormatter.formatSidedLabel(type, classification.getDirection(), safeLegs))
                .typeCode(positionFormatter.typeCode(type))
                .legsNotation(positionFormatter.formatLegsDisplay(safeLegs))
                .centerStrike(positionGeometry.centerStrike(safeLegs))
                .width(positionGeometry.width(safeLegs).orElse(null))
                .primaryExpiration(primaryExpiration)
                .dte(daysToExpiration(primaryExpiration, today))
                .asymmetric(type == PositionType.BWB || !classification.isSymmetric())
                .legs(safeLegs)
                .build();
    }

    /** Calendar days from today to expiration, never negative. 0 without an expiration. */
    int daysToExpiration(LocalDate expiration, LocalDate today) {
        if (expiration == null || today == null) {
            return 0;
        }
        return (int) Math.max(0, ChronoUnit.DAYS.between(today, expiration));
    }
}
