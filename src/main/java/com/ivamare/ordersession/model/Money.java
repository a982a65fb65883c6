package com.ivamare.ordersession.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Monetary helpers. All amounts carry two decimal places and round half up.
 */
public final class Money {

    public static final int SCALE = 2;

    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_UP);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private Money() {
        // Utility class - no instantiation
    }

    /**
     * Normalize an amount to the monetary scale; null becomes zero.
     *
     * @param amount the amount to normalize
     * @return the amount with scale 2
     */
    public static BigDecimal of(BigDecimal amount) {
        if (amount == null) {
            return ZERO;
        }
        return amount.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal of(String amount) {
        return of(new BigDecimal(amount));
    }

    /**
     * Compute {@code percent}% of {@code amount}, rounded to the monetary scale.
     *
     * @param amount the base amount
     * @param percent percentage in the range 0-100
     * @return the rounded share
     */
    public static BigDecimal percentOf(BigDecimal amount, BigDecimal percent) {
        return of(amount.multiply(percent).divide(HUNDRED, SCALE + 4, RoundingMode.HALF_UP));
    }

    public static BigDecimal min(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static boolean isPositive(BigDecimal amount) {
        return amount != null && amount.signum() > 0;
    }
}
