package com.faktura.billing.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point helpers for monetary amounts.
 * All persisted amounts carry two decimal places and are rounded half-up.
 */
public final class Money {

    public static final int SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private Money() {
    }

    public static BigDecimal of(String amount) {
        return normalize(new BigDecimal(amount));
    }

    public static BigDecimal of(long amount) {
        return normalize(BigDecimal.valueOf(amount));
    }

    /**
     * Rounds an amount to cents. Null is treated as zero.
     */
    public static BigDecimal normalize(BigDecimal amount) {
        if (amount == null) {
            return ZERO;
        }
        return amount.setScale(SCALE, ROUNDING);
    }

    public static boolean isPositive(BigDecimal amount) {
        return amount != null && amount.signum() > 0;
    }

    public static boolean isNegative(BigDecimal amount) {
        return amount != null && amount.signum() < 0;
    }

    public static boolean isZero(BigDecimal amount) {
        return amount == null || amount.signum() == 0;
    }

    /**
     * Returns {@code a - b}, floored at zero.
     */
    public static BigDecimal subtractFloorZero(BigDecimal a, BigDecimal b) {
        BigDecimal result = normalize(a).subtract(normalize(b));
        return result.signum() < 0 ? ZERO : result;
    }

    /**
     * Applies a percentage (e.g. 110 for 110%) to an amount, rounded to cents.
     */
    public static BigDecimal percentOf(BigDecimal amount, BigDecimal percent) {
        return normalize(normalize(amount).multiply(percent).divide(HUNDRED, SCALE + 4, ROUNDING));
    }
}
