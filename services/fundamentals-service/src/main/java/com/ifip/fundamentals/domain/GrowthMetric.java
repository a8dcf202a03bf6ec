package com.ifip.fundamentals.domain;

import java.time.LocalDate;

/**
 * Period-over-period change between two entries of the same bucket. {@code previousPeriod},
 * {@code previousValue} and {@code growthPct} are null when no comparison could be made.
 */
public record GrowthMetric(
    String metricName,
    GrowthKind kind,
    PeriodBucket bucket,
    LocalDate currentPeriod,
    LocalDate previousPeriod,
    double currentValue,
    Double previousValue,
    Double growthPct,
    boolean meaningful,
    boolean flagged
) {
}
