package com.flagship.expense_ledger.ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.function.Function;

/**
 * Monetary arithmetic shared by validation, netting and carry-forward.
 *
 * All amounts are two-decimal values rounded HALF_UP. Two amounts are
 * considered equal when they differ by at most {@link #EPSILON}.
 */
public final class Amounts {

    public static final int SCALE = 2;
    public static final BigDecimal EPSILON = new BigDecimal("0.01");
    public static final BigDecimal FULL_PERCENTAGE = new BigDecimal("100");
    public static final BigDecimal PERCENTAGE_TOLERANCE = new BigDecimal("0.1");

    private Amounts() {
        // Utility class
    }

    public static BigDecimal round(BigDecimal amount) {
        return amount.setScale(SCALE, RoundingMode.HALF_UP);
    }

    /**
     * True when {@code a} and {@code b} differ by no more than 0.01.
     */
    public static boolean matches(BigDecimal a, BigDecimal b) {
        return a.subtract(b).abs().compareTo(EPSILON) <= 0;
    }

    /**
     * True for rounding noise: magnitudes of 0.01 or less.
     */
    public static boolean isNegligible(BigDecimal amount) {
        return amount.abs().compareTo(EPSILON) <= 0;
    }

    public static <T> BigDecimal sum(Collection<T> items, Function<T, BigDecimal> amountOf) {
        return items.stream()
            .map(amountOf)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
