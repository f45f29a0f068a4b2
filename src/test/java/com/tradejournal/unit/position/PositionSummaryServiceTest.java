package com.tradejournal.unit.position;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradejournal.config.PositionProperties;
import com.tradejournal.domain.enums.OptionRight;
import com.tradejournal.domain.enums.PositionDirection;
import com.tradejournal.domain.enums.PositionType;
import com.tradejournal.domain.model.PositionLeg;
import com.tradejournal.domain.model.PositionSummary;
import com.tradejournal.position.PositionClassifier;
import com.tradejournal.position.PositionFormatter;
import com.tradejournal.position.PositionGeometry;
import com.tradejournal.position.PositionSummaryService;
import com.tradejournal.position.RatioNormalizer;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PositionSummaryServiceTest {

    private static final LocalDate EXP = LocalDate.of(2025, 1, 17);

    private PositionSummaryService service;

    @BeforeEach
    void setUp() {
        service = new PositionSummaryService(
                new PositionClassifier(new RatioNormalizer()),
                new PositionFormatter(),
                new PositionGeometry(),
                new PositionProperties());
    }

    private static PositionLeg leg(int strike, OptionRight right, int quantity) {
        return PositionLeg.builder()
                .strike(BigDecimal.valueOf(strike))
                .expiration(EXP)
                .right(right)
                .quantity(quantity)
                .build();
    }

    @Test
    @DisplayName("Short iron condor summary carries labels, geometry and dte")
    void ironCondorSummary() {
        List<PositionLeg> legs = List.of(
                leg(6030, OptionRight.CALL, 1),
                leg(5970, OptionRight.PUT, 1),
                leg(6010, OptionRight.CALL, -1),
                leg(5990, OptionRight.PUT, -1));

        PositionSummary summary = service.summarize("SPX", legs, LocalDate.of(2025, 1, 10));

        assertThat(summary.getSymbol()).isEqualTo("SPX");
        assertThat(summary.getPositionType()).isEqualTo(PositionType.IRON_CONDOR);
        assertThat(summary.getDirection()).isEqualTo(PositionDirection.SHORT);
        assertThat(summary.getLabel()).isEqualTo("Short Iron Condor");
        assertThat(summary.getSidedLabel()).isEqualTo("Short Iron Condor");
        assertThat(summary.getTypeCode()).isEqualTo("IC");
        assertThat(summary.getLegsNotation()).isEqualTo("+1 P 5970 / -1 P 5990 / -1 C 6010 / +1 C 6030");
        assertThat(summary.getCenterStrike()).isEqualByComparingTo("6000");
        assertThat(summary.getWidth()).isEqualByComparingTo("20");
        assertThat(summary.getPrimaryExpiration()).isEqualTo(EXP);
        assertThat(summary.getDte()).isEqualTo(7);
        assertThat(summary.isAsymmetric()).isFalse();
    }

    @Test
    @DisplayName("Raw legs are passed through untouched")
    void legsUntouched() {
        List<PositionLeg> legs = List.of(leg(6025, OptionRight.CALL, 1), leg(5980, OptionRight.CALL, 1),
                leg(6000, OptionRight.CALL, -2));

        PositionSummary summary = service.summarize("SPX", legs, EXP);

        assertThat(summary.getLegs()).isSameAs(legs);
        assertThat(summary.getPositionType()).isEqualTo(PositionType.BWB);
        assertThat(summary.isAsymmetric()).isTrue();
        assertThat(summary.getWidth()).isNull();
        assertThat(summary.getSidedLabel()).isEqualTo("Long Call BWB");
    }

    @Test
    @DisplayName("Expired positions report zero days to expiration")
    void expired() {
        PositionSummary summary = service.summarize("SPX", List.of(leg(6000, OptionRight.PUT, -1)),
                LocalDate.of(2025, 2, 1));

        assertThat(summary.getDte()).isZero();
    }

    @Test
    @DisplayName("Empty legs give a custom summary")
    void emptyLegs() {
        PositionSummary summary = service.summarize("SPX", null, EXP);

        assertThat(summary.getPositionType()).isEqualTo(PositionType.CUSTOM);
        assertThat(summary.getLabel()).isEqualTo("Custom");
        assertThat(summary.getLegsNotation()).isEmpty();
        assertThat(summary.getPrimaryExpiration()).isNull();
        assertThat(summary.getLegs()).isEmpty();
    }
}
