package com.tradejournal.domain.model;

import com.tradejournal.domain.enums.OptionRight;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * A single option contract line of a position: strike, expiration, right and
 * signed quantity.
 *
 * <p>Quantity sign convention: positive = long, negative = short. The magnitude is
 * the contract ratio within the structure (a butterfly body is -2), not
 * necessarily 1.
 *
 * <p>Legs are editor state. Any field may be null or zero while the user is typing;
 * the position engine tolerates that and callers validate before saving.
 */
@Value
@Builder(toBuilder = true)
public class PositionLeg {

    BigDecimal strike;

    LocalDate expiration;

    OptionRight right;

    /** Signed quantity: positive = long, negative = short. */
    int quantity;

    /** True when strike, expiration and right are all filled in. */
    public boolean isComplete() {
        return strike != null && expiration != null && right != null;
    }

    public PositionLeg withQuantity(int newQuantity) {
        return toBuilder().quantity(newQuantity).build();
    }
}
