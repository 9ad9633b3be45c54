package com.spreadbook.reconciliation;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Quantity-weighted average price arithmetic shared by the pre-merger and the position merger.
 */
final class CostBasis {

    private CostBasis() {}

    /**
     * {@code (qtyA * priceA + qtyB * priceB) / (qtyA + qtyB)}.
     *
     * <p>A missing price counts as zero unless both are missing, in which case the result is null.
     * When the quantities cancel out the newer price is returned, there is nothing to weight.
     */
    static BigDecimal weightedAverage(long qtyA, BigDecimal priceA, long qtyB, BigDecimal priceB, int scale) {
        if (priceA == null && priceB == null) {
            return null;
        }
        long total = qtyA + qtyB;
        if (total == 0) {
            return priceB != null ? priceB : priceA;
        }
        BigDecimal valueA = orZero(priceA).multiply(BigDecimal.valueOf(qtyA));
        BigDecimal valueB = orZero(priceB).multiply(BigDecimal.valueOf(qtyB));
        return valueA.add(valueB).divide(BigDecimal.valueOf(total), scale, RoundingMode.HALF_UP);
    }

    static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
