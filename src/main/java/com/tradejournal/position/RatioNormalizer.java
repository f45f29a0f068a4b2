package com.tradejournal.position;

import org.springframework.stereotype.Component;

/**
 * Reduces signed leg quantities to their smallest integer ratio.
 *
 * <p>A 2-lot butterfly ({@code +2/-4/+2}) and a 1-lot butterfly ({@code +1/-2/+1})
 * are the same structure, so the classifier matches patterns on the reduced
 * ratios. Signs are preserved; zeros are left as zeros and do not take part in
 * the divisor.
 */
@Component
public class RatioNormalizer {

    /**
     * Returns the quantities divided by the greatest common divisor of their
     * absolute values. An empty or all-zero input is returned as-is.
     */
    public int[] normalize(int[] quantities) {
        int divisor = gcd(quantities);
        int[] ratios = new int[quantities.length];
        for (int i = 0; i < quantities.length; i++) {
            ratios[i] = divisor > 1 ? quantities[i] / divisor : quantities[i];
        }
        return ratios;
    }

    /** GCD of the absolute values, ignoring zeros. 0 when every value is zero. */
    public int gcd(int[] quantities) {
        int result = 0;
        for (int quantity : quantities) {
            result = gcd(result, Math.abs(quantity));
            if (result == 1) {
                return 1;
            }
        }
        return result;
    }

    static int gcd(int a, int b) {
        while (b != 0) {
            int t = a % b;
            a = b;
            b = t;
        }
        return a;
    }
}
