package com.chainexplorer.common;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Exact parsing of integer amounts in base units. Balances and fees never pass through floating point.
 */
public final class ExactAmounts {

    private ExactAmounts() {
    }

    /**
     * Parses a nonnegative integer amount. Accepts plain digits, a decimal string with an all-zero fraction
     * ("12.0") and exponent notation that resolves to an integer ("1e18").
     *
     * @throws IllegalArgumentException when the value is negative, fractional or not a number
     */
    public static BigInteger parseNonNegative(String raw) {
        if (raw == null || raw.isBlank()) {
            return BigInteger.ZERO;
        }
        BigInteger value;
        try {
            value = new BigDecimal(raw.trim()).toBigIntegerExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new IllegalArgumentException("Not an integer amount: " + raw, e);
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Negative amount: " + raw);
        }
        return value;
    }
}
