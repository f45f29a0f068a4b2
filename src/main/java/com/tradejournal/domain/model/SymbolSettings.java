package com.tradejournal.domain.model;

import com.tradejournal.domain.enums.ExpirationPattern;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Resolved per-symbol trading parameters used to seed the position editor:
 * strike grid, default and minimum wing width, visible strike range and listing
 * cadence.
 */
@Value
@Builder
public class SymbolSettings {

    String symbol;

    /** Key of the spot feed for this symbol, e.g. "I:SPX". Stocks use the raw ticker. */
    String spotKey;

    BigDecimal strikeIncrement;
    BigDecimal defaultWidth;
    BigDecimal minWidth;
    BigDecimal strikeRange;
    ExpirationPattern expirationPattern;
}
