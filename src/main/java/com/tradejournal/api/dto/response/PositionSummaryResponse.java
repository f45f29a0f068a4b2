package com.tradejournal.api.dto.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.tradejournal.api.dto.request.LegDto;
import com.tradejournal.domain.enums.PositionDirection;
import com.tradejournal.domain.enums.PositionType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
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
public class PositionSummaryResponse {
    private String symbol;
    private PositionType positionType;
    private PositionDirection direction;
    private boolean symmetric;
    private String label;
    private String sidedLabel;
    private String typeCode;
    private String legsNotation;
    private BigDecimal centerStrike;
    private BigDecimal width;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate primaryExpiration;

    private int dte;
    private boolean asymmetric;
    private List<LegDto> legs;
}
