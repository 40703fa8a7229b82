package com.plazaintel.comparisons.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Change of one metric between two periods (or two years).
 * A zero baseline reports 0.0 percent rather than infinity.
 */
public record MetricDelta(long period1, long period2, long change, double percentChange) {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public static MetricDelta between(long period1, long period2) {
        long change = period2 - period1;
        return new MetricDelta(period1, period2, change, percentChange(period1, change));
    }

    static double percentChange(long base, long change) {
        if (base == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(change)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(base), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
