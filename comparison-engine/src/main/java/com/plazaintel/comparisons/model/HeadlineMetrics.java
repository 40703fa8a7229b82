package com.plazaintel.comparisons.model;

import java.util.Locale;

/**
 * Short summary for dashboard cards, e.g. "CN Total +1,234".
 */
public record HeadlineMetrics(
        long newPlazas,
        long removedPlazas,
        long certificationTotalChange,
        String summary) {

    public static HeadlineMetrics from(PlazaChurn churn, MetricDelta certificationTotal) {
        long change = certificationTotal.change();
        String summary = String.format(Locale.ROOT, "CN Total %s%,d", change >= 0 ? "+" : "", change);
        return new HeadlineMetrics(churn.newPlazas(), churn.removedPlazas(), change, summary);
    }
}
