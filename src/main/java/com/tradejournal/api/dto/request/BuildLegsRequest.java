package com.tradejournal.api.dto.request;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.tradejournal.domain.enums.OptionRight;
import com.tradejournal.domain.enums.PositionDirection;
import com.tradejournal.domain.enums.PositionType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Request to build the canonical legs of a structure.
 *
 * <p>Either {@code baseStrike} or {@code spotPrice} must be given; a spot price is
 * rounded to the symbol's strike increment. A missing width uses the symbol's
 * default width, a missing direction the type's default.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BuildLegsRequest {

    @NotNull(message = "Position type is required")
    private PositionType type;

    private String symbol;

    @Positive(message = "Base strike must be greater than 0")
    private BigDecimal baseStrike;

    @Positive(message = "Spot price must be greater than 0")
    private BigDecimal spotPrice;

    @Positive(message = "Width must be greater than 0")
    private BigDecimal width;

    /** Upper wing of a broken-wing butterfly. */
    @Positive(message = "Upper width must be greater than 0")
    private BigDecimal upperWidth;

    @NotNull(message = "Expiration is required")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate expiration;

    /** Far leg of a calendar or diagonal. Defaults to the next listed expiration. */
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate farExpiration;

    private OptionRight right;

    private PositionDirection direction;
}
