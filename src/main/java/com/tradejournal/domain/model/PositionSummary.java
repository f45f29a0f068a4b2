package com.tradejournal.domain.model;

import com.tradejournal.domain.enums.PositionDirection;
import com.tradejournal.domain.enums.PositionType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Display-ready view of a position, derived entirely from its legs.
 *
 * <p>Carries the fields the journal list and risk-graph legend show: structure
 * type and labels, the leg notation, center strike, wing width, primary expiration
 * and days to expiration. The legs are passed through untouched so the caller can
 * persist exactly what the user entered.
 */
@Value
@Builder
public class PositionSummary {

    String symbol;
    PositionType positionType;
    PositionDirection direction;
    boolean symmetric;

    /** "Short Iron Condor" */
    String label;

    /** "Long Call Butterfly" for single-right structures, otherwise same as label. */
    String sidedLabel;

    String typeCode;

    /** "+1 C 5980 / -2 C 6000 / +1 C 6020" */
    String legsNotation;

    BigDecimal centerStrike;

    /** Null for asymmetric 3-leg structures and single legs. */
    BigDecimal width;

    LocalDate primaryExpiration;

    int dte;

    /** True for a BWB or any structure classified as asymmetric. */
    boolean asymmetric;

    List<PositionLeg> legs;
}
