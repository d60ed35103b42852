package com.b2b.inventory.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Units sold from one inventory row over a trailing window.
 * The daily average always divides by the full window length, not by the days that had sales.
 */
public record SalesVelocity(
    long inventoryId,
    long unitsSold,
    int windowDays
) {
    private static final int AVERAGE_SCALE = 4;

    public SalesVelocity {
        if (windowDays < 1) {
            throw new IllegalArgumentException("windowDays must be at least 1: " + windowDays);
        }
    }

    public boolean hasSales() {
        return unitsSold > 0;
    }

    public BigDecimal averageDailySales() {
        return BigDecimal.valueOf(unitsSold)
                .divide(BigDecimal.valueOf(windowDays), AVERAGE_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * ceil(stock / (unitsSold / windowDays)), evaluated as ceil(stock * windowDays / unitsSold)
     * so the result is exact. Null when nothing sold.
     */
    public Long daysUntilStockout(int currentStock) {
        if (unitsSold <= 0) {
            return null;
        }
        long numerator = (long) Math.max(currentStock, 0) * windowDays;
        return Math.floorDiv(numerator + unitsSold - 1, unitsSold);
    }
}
