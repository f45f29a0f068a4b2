package com.tradejournal.api.dto.request;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.tradejournal.domain.enums.OptionRight;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Wire form of a position leg: {@code {strike, expiration: "YYYY-MM-DD", right: "call"|"put", quantity}}.
 *
 * <p>No bean validation here: the preview endpoints accept half-filled legs while the
 * user edits, and save-time checks run through the leg validator.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LegDto {

    private BigDecimal strike;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate expiration;

    private OptionRight right;

    /** Signed quantity: positive = long, negative = short. */
    private Integer quantity;
}
