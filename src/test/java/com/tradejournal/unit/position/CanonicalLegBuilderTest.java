package com.tradejournal.unit.position;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradejournal.calendar.ExpirationCalendar;
import com.tradejournal.config.PositionProperties;
import com.tradejournal.domain.enums.ExpirationPattern;
import com.tradejournal.domain.enums.OptionRight;
import com.tradejournal.domain.enums.PositionDirection;
import com.tradejournal.domain.enums.PositionType;
import com.tradejournal.domain.model.LegBuildRequest;
import com.tradejournal.domain.model.PositionClassification;
import com.tradejournal.domain.model.PositionLeg;
import com.tradejournal.position.CanonicalLegBuilder;
import com.tradejournal.position.PositionClassifier;
import com.tradejournal.position.RatioNormalizer;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

/**
 * Unit tests for CanonicalLegBuilder: leg layouts per type, direction handling,
 * defaults for missing anchors, and the build-then-classify round trip.
 */
class CanonicalLegBuilderTest {

    /** A Friday. */
    private static final LocalDate EXP = LocalDate.of(2025, 1, 17);
    private static final BigDecimal K = BigDecimal.valueOf(6000);
    private static final BigDecimal W = BigDecimal.valueOf(20);

    private CanonicalLegBuilder builder;
    private PositionClassifier classifier;

    @BeforeEach
    void setUp() {
        builder = new CanonicalLegBuilder(new ExpirationCalendar(), new PositionProperties());
        classifier = new PositionClassifier(new RatioNormalizer());
    }

    private static List<Integer> strikes(List<PositionLeg> legs) {
        return legs.stream().map(leg -> leg.getStrike().intValueExact()).toList();
    }

    private static List<Integer> quantities(List<PositionLeg> legs) {
        return legs.stream().map(PositionLeg::getQuantity).toList();
    }

    private static List<OptionRight> rights(List<PositionLeg> legs) {
        return legs.stream().map(PositionLeg::getRight).toList();
    }

    // ========================
    // LAYOUTS
    // ========================

    @Nested
    @DisplayName("Layouts")
    class Layouts {

        @Test
        @DisplayName("Long call butterfly: +1 5980 / -2 6000 / +1 6020")
        void butterfly() {
            List<PositionLeg> legs =
                    builder.build(PositionType.BUTTERFLY, K, W, EXP, OptionRight.CALL, PositionDirection.LONG);

            assertThat(strikes(legs)).containsExactly(5980, 6000, 6020);
            assertThat(quantities(legs)).containsExactly(1, -2, 1);
            assertThat(legs).allSatisfy(leg -> {
                assertThat(leg.getRight()).isEqualTo(OptionRight.CALL);
                assertThat(leg.getExpiration()).isEqualTo(EXP);
            });
        }

        @Test
        @DisplayName("Short butterfly negates every quantity")
        void shortButterfly() {
            List<PositionLeg> legs =
                    builder.build(PositionType.BUTTERFLY, K, W, EXP, OptionRight.PUT, PositionDirection.SHORT);

            assertThat(quantities(legs)).containsExactly(-1, 2, -1);
            assertThat(rights(legs)).containsOnly(OptionRight.PUT);
        }

        @Test
        @DisplayName("BWB upper wing defaults to twice the width")
        void brokenWingDefault() {
            List<PositionLeg> legs =
                    builder.build(PositionType.BWB, K, W, EXP, OptionRight.CALL, PositionDirection.LONG);

            assertThat(strikes(legs)).containsExactly(5980, 6000, 6040);
            assertThat(quantities(legs)).containsExactly(1, -2, 1);
        }

        @Test
        @DisplayName("BWB with explicit wing widths")
        void brokenWingExplicit() {
            List<PositionLeg> legs = builder.buildBrokenWing(
                    K, W, BigDecimal.valueOf(25), EXP, OptionRight.CALL, PositionDirection.LONG);

            assertThat(strikes(legs)).containsExactly(5980, 6000, 6025);
            assertThat(classifier.classify(legs).getType()).isEqualTo(PositionType.BWB);
        }

        @Test
        @DisplayName("BWB with equal wings degenerates to a butterfly")
        void brokenWingEqualWidths() {
            List<PositionLeg> legs =
                    builder.buildBrokenWing(K, W, W, EXP, OptionRight.CALL, PositionDirection.LONG);

            assertThat(classifier.classify(legs).getType()).isEqualTo(PositionType.BUTTERFLY);
        }

        @Test
        @DisplayName("Call vertical: long base strike, short base + width")
        void callVertical() {
            List<PositionLeg> legs =
                    builder.build(PositionType.VERTICAL, K, W, EXP, OptionRight.CALL, PositionDirection.LONG);

            assertThat(strikes(legs)).containsExactly(6000, 6020);
            assertThat(quantities(legs)).containsExactly(1, -1);
        }

        @Test
        @DisplayName("Put vertical: long base - width, short base strike")
        void putVertical() {
            List<PositionLeg> legs =
                    builder.build(PositionType.VERTICAL, K, W, EXP, OptionRight.PUT, PositionDirection.LONG);

            assertThat(strikes(legs)).containsExactly(5980, 6000);
            assertThat(quantities(legs)).containsExactly(1, -1);
        }

        @Test
        @DisplayName("Condor straddles the base strike at half and one and a half widths")
        void condor() {
            List<PositionLeg> legs =
                    builder.build(PositionType.CONDOR, K, W, EXP, OptionRight.CALL, PositionDirection.LONG);

            assertThat(strikes(legs)).containsExactly(5970, 5990, 6010, 6030);
            assertThat(quantities(legs)).containsExactly(1, -1, -1, 1);
        }

        @Test
        @DisplayName("Iron condor: put spread below, call spread above, short by default")
        void ironCondor() {
            List<PositionLeg> legs = builder.build(PositionType.IRON_CONDOR, K, W, EXP, null, null);

            assertThat(strikes(legs)).containsExactly(5970, 5990, 6010, 6030);
            assertThat(rights(legs)).containsExactly(OptionRight.PUT, OptionRight.PUT, OptionRight.CALL, OptionRight.CALL);
            assertThat(quantities(legs)).containsExactly(-1, 1, 1, -1);
        }

        @Test
        @DisplayName("Iron fly shares the body strike between put and call")
        void ironFly() {
            List<PositionLeg> legs =
                    builder.build(PositionType.IRON_FLY, K, W, EXP, OptionRight.CALL, PositionDirection.SHORT);

            assertThat(strikes(legs)).containsExactly(5980, 6000, 6000, 6020);
            assertThat(rights(legs)).containsExactly(OptionRight.PUT, OptionRight.PUT, OptionRight.CALL, OptionRight.CALL);
            assertThat(quantities(legs)).containsExactly(-1, 1, 1, -1);
        }

        @Test
        @DisplayName("Straddle ignores the requested right and builds one put and one call")
        void straddle() {
            List<PositionLeg> legs =
                    builder.build(PositionType.STRADDLE, K, W, EXP, OptionRight.CALL, PositionDirection.SHORT);

            assertThat(strikes(legs)).containsExactly(6000, 6000);
            assertThat(rights(legs)).containsExactly(OptionRight.PUT, OptionRight.CALL);
            assertThat(quantities(legs)).containsExactly(-1, -1);
        }

        @Test
        @DisplayName("Strangle places the put one width below and the call one width above")
        void strangle() {
            List<PositionLeg> legs =
                    builder.build(PositionType.STRANGLE, K, W, EXP, null, PositionDirection.LONG);

            assertThat(strikes(legs)).containsExactly(5980, 6020);
            assertThat(rights(legs)).containsExactly(OptionRight.PUT, OptionRight.CALL);
            assertThat(quantities(legs)).containsExactly(1, 1);
        }

        @Test
        @DisplayName("Calendar sells the near expiration and buys the next daily one")
        void calendar() {
            List<PositionLeg> legs =
                    builder.build(PositionType.CALENDAR, K, W, EXP, OptionRight.PUT, PositionDirection.LONG);

            assertThat(strikes(legs)).containsExactly(6000, 6000);
            assertThat(quantities(legs)).containsExactly(-1, 1);
            assertThat(legs.get(0).getExpiration()).isEqualTo(EXP);
            // Friday -> Monday
            assertThat(legs.get(1).getExpiration()).isEqualTo(LocalDate.of(2025, 1, 20));
        }

        @Test
        @DisplayName("Calendar honours an explicit far expiration and pattern")
        void calendarFarExpiration() {
            LocalDate far = LocalDate.of(2025, 3, 21);
            List<PositionLeg> explicit = builder.build(LegBuildRequest.builder()
                    .type(PositionType.CALENDAR)
                    .baseStrike(K)
                    .expiration(EXP)
                    .farExpiration(far)
                    .build());
            List<PositionLeg> monthly = builder.build(LegBuildRequest.builder()
                    .type(PositionType.CALENDAR)
                    .baseStrike(K)
                    .expiration(EXP)
                    .expirationPattern(ExpirationPattern.MONTHLY)
                    .build());

            assertThat(explicit.get(1).getExpiration()).isEqualTo(far);
            assertThat(monthly.get(1).getExpiration()).isEqualTo(LocalDate.of(2025, 2, 21));
        }

        @Test
        @DisplayName("Diagonal moves the far leg up by the width")
        void diagonal() {
            List<PositionLeg> legs =
                    builder.build(PositionType.DIAGONAL, K, W, EXP, OptionRight.CALL, PositionDirection.LONG);

            assertThat(strikes(legs)).containsExactly(6000, 6020);
            assertThat(quantities(legs)).containsExactly(-1, 1);
            assertThat(legs.get(1).getExpiration()).isAfter(legs.get(0).getExpiration());
        }
    }

    // ========================
    // DEFAULTS
    // ========================

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("Null direction uses the type's default")
        void defaultDirection() {
            assertThat(quantities(builder.build(PositionType.STRADDLE, K, W, EXP, null, null)))
                    .containsExactly(-1, -1);
            assertThat(quantities(builder.build(PositionType.BUTTERFLY, K, W, EXP, null, null)))
                    .containsExactly(1, -2, 1);
        }

        @Test
        @DisplayName("Null right builds calls")
        void defaultRight() {
            assertThat(rights(builder.build(PositionType.VERTICAL, K, W, EXP, null, null)))
                    .containsOnly(OptionRight.CALL);
        }

        @Test
        @DisplayName("Custom yields a single long leg at the base strike")
        void custom() {
            List<PositionLeg> legs = builder.build(PositionType.CUSTOM, K, W, EXP, OptionRight.PUT, null);

            assertThat(legs).hasSize(1);
            assertThat(legs.get(0).getStrike()).isEqualByComparingTo(K);
            assertThat(legs.get(0).getQuantity()).isEqualTo(1);
            assertThat(legs.get(0).getRight()).isEqualTo(OptionRight.PUT);
        }

        @Test
        @DisplayName("Null type and anchors never throw")
        void nullsTolerated() {
            List<PositionLeg> legs = builder.build(null, null, null, null, null, null);

            assertThat(legs).hasSize(1);
            assertThat(legs.get(0).getStrike()).isEqualByComparingTo(BigDecimal.ZERO);
            assertThat(builder.build(PositionType.CALENDAR, K, W, null, null, null)).hasSize(2);
        }

        @Test
        @DisplayName("Every build returns fresh leg objects")
        void freshLegs() {
            List<PositionLeg> first = builder.build(PositionType.BUTTERFLY, K, W, EXP, null, null);
            List<PositionLeg> second = builder.build(PositionType.BUTTERFLY, K, W, EXP, null, null);

            assertThat(first).isEqualTo(second);
            assertThat(first.get(0)).isNotSameAs(second.get(0));
        }
    }

    // ========================
    // ROUND TRIP
    // ========================

    @Nested
    @DisplayName("Round trip")
    class RoundTrip {

        @ParameterizedTest(name = "{0} long and short")
        @EnumSource(value = PositionType.class, names = "CUSTOM", mode = EnumSource.Mode.EXCLUDE)
        @DisplayName("Classifying built legs returns the requested type and direction")
        void classifyInvertsBuild(PositionType type) {
            for (PositionDirection direction : PositionDirection.values()) {
                for (OptionRight right : OptionRight.values()) {
                    List<PositionLeg> legs = builder.build(type, K, W, EXP, right, direction);
                    PositionClassification result = classifier.classify(legs);

                    assertThat(result.getType()).as("%s %s %s", direction, right, type).isEqualTo(type);
                    assertThat(result.getDirection()).as("%s %s %s", direction, right, type).isEqualTo(direction);
                }
            }
        }

        @ParameterizedTest(name = "{0}")
        @EnumSource(value = PositionType.class, names = {"BUTTERFLY", "CONDOR", "IRON_FLY", "IRON_CONDOR"})
        @DisplayName("Symmetric structures are built symmetric")
        void builtSymmetric(PositionType type) {
            assertThat(classifier.classify(builder.build(type, K, W, EXP, null, null)).isSymmetric()).isTrue();
        }
    }

    // ========================
    // HELPERS
    // ========================

    @Nested
    @DisplayName("Warnings and rounding")
    class WarningsAndRounding {

        @Test
        @DisplayName("Short calendar and short diagonal carry a volatility warning")
        void shortTimeSpreadWarning() {
            assertThat(builder.warningsFor(PositionType.CALENDAR, PositionDirection.SHORT))
                    .singleElement(InstanceOfAssertFactories.STRING)
                    .startsWith("Short calendar");
            assertThat(builder.warningsFor(PositionType.DIAGONAL, PositionDirection.SHORT)).hasSize(1);
        }

        @Test
        @DisplayName("Long time spreads and other types carry no warning")
        void noWarning() {
            assertThat(builder.warningsFor(PositionType.CALENDAR, PositionDirection.LONG)).isEmpty();
            assertThat(builder.warningsFor(PositionType.CALENDAR, null)).isEmpty();
            assertThat(builder.warningsFor(PositionType.IRON_CONDOR, PositionDirection.SHORT)).isEmpty();
            assertThat(builder.warningsFor(null, PositionDirection.SHORT)).isEmpty();
        }

        @Test
        @DisplayName("Rounds to the nearest strike, half up")
        void roundToIncrement() {
            assertThat(builder.roundToIncrement(new BigDecimal("6012.4"), BigDecimal.valueOf(5)))
                    .isEqualByComparingTo("6010");
            assertThat(builder.roundToIncrement(new BigDecimal("6012.5"), BigDecimal.valueOf(5)))
                    .isEqualByComparingTo("6015");
            assertThat(builder.roundToIncrement(new BigDecimal("447.3"), BigDecimal.ONE))
                    .isEqualByComparingTo("447");
        }

        @Test
        @DisplayName("Missing increment returns the price unchanged")
        void roundWithoutIncrement() {
            assertThat(builder.roundToIncrement(new BigDecimal("6012.4"), null)).isEqualByComparingTo("6012.4");
            assertThat(builder.roundToIncrement(null, BigDecimal.ONE)).isEqualByComparingTo("0");
        }
    }
}
