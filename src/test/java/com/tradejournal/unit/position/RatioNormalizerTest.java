package com.tradejournal.unit.position;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradejournal.position.RatioNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RatioNormalizerTest {

    private final RatioNormalizer normalizer = new RatioNormalizer();

    @Test
    @DisplayName("2-lot butterfly reduces to 1-2-1 keeping signs")
    void reducesButterfly() {
        assertThat(normalizer.normalize(new int[] {2, -4, 2})).containsExactly(1, -2, 1);
    }

    @Test
    @DisplayName("Already reduced ratios are unchanged")
    void alreadyReduced() {
        assertThat(normalizer.normalize(new int[] {1, -2, 1})).containsExactly(1, -2, 1);
        assertThat(normalizer.normalize(new int[] {2, -3})).containsExactly(2, -3);
    }

    @Test
    @DisplayName("Zeros stay zero and do not affect the divisor")
    void zeros() {
        assertThat(normalizer.normalize(new int[] {0, -6, 3})).containsExactly(0, -2, 1);
        assertThat(normalizer.normalize(new int[] {0, 0})).containsExactly(0, 0);
    }

    @Test
    @DisplayName("Single short leg reduces to -1")
    void singleLeg() {
        assertThat(normalizer.normalize(new int[] {-5})).containsExactly(-1);
    }

    @Test
    @DisplayName("GCD of absolute values")
    void gcd() {
        assertThat(normalizer.gcd(new int[] {-10, 15, 25})).isEqualTo(5);
        assertThat(normalizer.gcd(new int[] {})).isZero();
    }
}
