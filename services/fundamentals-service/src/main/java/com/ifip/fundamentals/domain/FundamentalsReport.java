package com.ifip.fundamentals.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Everything known about one ticker's reported fundamentals. A {@code degraded} report was built
 * without fresh provider data; its warnings explain why.
 */
public record FundamentalsReport(
    String ticker,
    String cik,
    String companyName,
    Map<LogicalMetric, ConceptSeries> series,
    List<LogicalMetric> unavailableMetrics,
    List<GrowthMetric> growth,
    List<DerivedRatio> ratios,
    QualityReport quality,
    List<Warning> warnings,
    boolean degraded,
    Instant generatedAt
) {
    public FundamentalsReport {
        series = series.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(series));
        unavailableMetrics = List.copyOf(unavailableMetrics);
        growth = List.copyOf(growth);
        ratios = List.copyOf(ratios);
        warnings = List.copyOf(warnings);
    }
}
