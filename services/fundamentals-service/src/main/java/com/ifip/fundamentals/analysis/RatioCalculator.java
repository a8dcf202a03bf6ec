package com.ifip.fundamentals.analysis;

import com.ifip.fundamentals.domain.ClassifiedFact;
import com.ifip.fundamentals.domain.ConceptSeries;
import com.ifip.fundamentals.domain.DerivedRatio;
import com.ifip.fundamentals.domain.LogicalMetric;
import com.ifip.fundamentals.domain.PeriodBucket;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Margins, free cash flow and return ratios derived from the classified series.
 *
 * <p>Flow-over-flow ratios pair entries of the same bucket and period end, preferring the latest
 * quarter and falling back to the latest fiscal year. Returns on equity and assets annualize the
 * latest quarterly net income. A ratio is skipped when an input is missing or its denominator is
 * zero.
 */
@Component
public class RatioCalculator {

    static final String PERCENT = "%";
    static final String USD = "USD";
    static final String MULTIPLE = "x";

    public List<DerivedRatio> calculate(Map<LogicalMetric, ConceptSeries> series) {
        List<DerivedRatio> ratios = new ArrayList<>();

        margin(series, "grossMargin", LogicalMetric.GROSS_PROFIT).ifPresent(ratios::add);
        margin(series, "operatingMargin", LogicalMetric.OPERATING_INCOME).ifPresent(ratios::add);
        margin(series, "netMargin", LogicalMetric.NET_INCOME).ifPresent(ratios::add);

        latestPair(series, LogicalMetric.OPERATING_CASH_FLOW, LogicalMetric.CAPITAL_EXPENDITURES)
            .map(p -> new DerivedRatio("freeCashFlow", p.first() - Math.abs(p.second()), USD, p.period()))
            .ifPresent(ratios::add);

        annualizedReturn(series, "returnOnEquity", LogicalMetric.STOCKHOLDERS_EQUITY).ifPresent(ratios::add);
        annualizedReturn(series, "returnOnAssets", LogicalMetric.TOTAL_ASSETS).ifPresent(ratios::add);

        Optional<ClassifiedFact> liabilities = latestBalance(series, LogicalMetric.TOTAL_LIABILITIES);
        Optional<ClassifiedFact> equity = latestBalance(series, LogicalMetric.STOCKHOLDERS_EQUITY);
        if (liabilities.isPresent() && equity.isPresent() && equity.get().value() != 0) {
            ratios.add(new DerivedRatio("debtToEquity", liabilities.get().value() / equity.get().value(), MULTIPLE,
                equity.get().periodEnd()));
        }
        return ratios;
    }

    private Optional<DerivedRatio> margin(Map<LogicalMetric, ConceptSeries> series, String name, LogicalMetric numerator) {
        return latestPair(series, numerator, LogicalMetric.REVENUE)
            .filter(p -> p.second() != 0)
            .map(p -> new DerivedRatio(name, p.first() / p.second() * 100.0, PERCENT, p.period()));
    }

    private Optional<DerivedRatio> annualizedReturn(
        Map<LogicalMetric, ConceptSeries> series,
        String name,
        LogicalMetric base
    ) {
        ConceptSeries netIncome = series.get(LogicalMetric.NET_INCOME);
        Optional<ClassifiedFact> balance = latestBalance(series, base);
        if (netIncome == null || balance.isEmpty() || balance.get().value() == 0) {
            return Optional.empty();
        }
        return netIncome.latest(PeriodBucket.QUARTERLY)
            .map(q -> new DerivedRatio(name, q.value() * 4 / balance.get().value() * 100.0, PERCENT, q.periodEnd()));
    }

    private static Optional<ClassifiedFact> latestBalance(Map<LogicalMetric, ConceptSeries> series, LogicalMetric metric) {
        ConceptSeries balance = series.get(metric);
        return balance == null ? Optional.empty() : balance.latest(PeriodBucket.POINT_IN_TIME);
    }

    /**
     * Latest period end both metrics report in the same bucket, quarters first.
     */
    static Optional<Pair> latestPair(Map<LogicalMetric, ConceptSeries> series, LogicalMetric first, LogicalMetric second) {
        ConceptSeries a = series.get(first);
        ConceptSeries b = series.get(second);
        if (a == null || b == null) {
            return Optional.empty();
        }
        for (PeriodBucket bucket : List.of(PeriodBucket.QUARTERLY, PeriodBucket.ANNUAL)) {
            TreeMap<LocalDate, Double> byEnd = new TreeMap<>();
            for (ClassifiedFact entry : b.bucket(bucket)) {
                byEnd.put(entry.periodEnd(), entry.value());
            }
            List<ClassifiedFact> entries = a.bucket(bucket);
            for (int i = entries.size() - 1; i >= 0; i--) {
                ClassifiedFact entry = entries.get(i);
                Double other = byEnd.get(entry.periodEnd());
                if (other != null) {
                    return Optional.of(new Pair(entry.value(), other, entry.periodEnd()));
                }
            }
        }
        return Optional.empty();
    }

    record Pair(double first, double second, LocalDate period) {
    }
}
