package com.tradejournal.api.dto.response;

import com.tradejournal.domain.enums.ExpirationPattern;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SymbolSettingsResponse {
    private String symbol;
    private String spotKey;
    private BigDecimal strikeIncrement;
    private BigDecimal defaultWidth;
    private BigDecimal minWidth;
    private BigDecimal strikeRange;
    private ExpirationPattern expirationPattern;
}
