package com.tradejournal.domain.model;

import com.tradejournal.domain.enums.ExpirationPattern;
import com.tradejournal.domain.enums.OptionRight;
import com.tradejournal.domain.enums.PositionDirection;
import com.tradejournal.domain.enums.PositionType;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Anchor parameters for building the canonical legs of a structure.
 *
 * <p>Only {@code type}, {@code baseStrike}, {@code width} and {@code expiration} are
 * needed for most structures. The optional fields refine specific types:
 * <ul>
 *   <li>{@code upperWidth}: upper wing of a broken-wing butterfly; {@code width} is
 *       then the lower wing</li>
 *   <li>{@code farExpiration}: far leg of a calendar or diagonal; when null it is the
 *       next expiration after {@code expiration} per {@code expirationPattern}</li>
 * </ul>
 * A null direction means the type's default direction; a null right means CALL.
 */
@Value
@Builder
public class LegBuildRequest {

    PositionType type;
    BigDecimal baseStrike;
    BigDecimal width;
    BigDecimal upperWidth;
    LocalDate expiration;
    LocalDate farExpiration;
    OptionRight right;
    PositionDirection direction;
    ExpirationPattern expirationPattern;
}
