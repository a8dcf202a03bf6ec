package com.ifip.fundamentals.analysis;

import com.ifip.fundamentals.domain.ClassifiedFact;
import com.ifip.fundamentals.domain.ConceptSeries;
import com.ifip.fundamentals.domain.LogicalMetric;
import com.ifip.fundamentals.domain.PeriodBucket;
import com.ifip.fundamentals.domain.Warning;
import com.ifip.fundamentals.domain.WarningCode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Cross-checks classified series against accounting identities: four quarters add up to the
 * fiscal year, and assets equal liabilities plus equity.
 */
@Component
public class ConsistencyValidator {

    static final double QUARTERLY_SUM_TOLERANCE = 0.05;
    static final double BALANCE_SHEET_TOLERANCE = 0.02;

    public List<Warning> validate(Map<LogicalMetric, ConceptSeries> series) {
        List<Warning> warnings = new ArrayList<>();
        for (ConceptSeries s : series.values()) {
            if (!s.metric().isInstant()) {
                warnings.addAll(checkQuarterlySums(s));
            }
        }
        checkBalanceSheet(series).ifPresent(warnings::add);
        return warnings;
    }

    List<Warning> checkQuarterlySums(ConceptSeries series) {
        FiscalCalendar calendar = FiscalCalendar.ofYearEndMonth(series.fiscalYearEndMonth());
        Map<Integer, Map<Integer, Double>> quartersByYear = new TreeMap<>();
        for (ClassifiedFact entry : series.quarterly()) {
            quartersByYear
                .computeIfAbsent(calendar.fiscalYear(entry.periodEnd()), y -> new HashMap<>())
                .put(calendar.fiscalQuarter(entry.periodEnd()), entry.value());
        }
        Map<Integer, Double> annualByYear = new HashMap<>();
        for (ClassifiedFact entry : series.annual()) {
            annualByYear.put(calendar.fiscalYear(entry.periodEnd()), entry.value());
        }

        List<Warning> warnings = new ArrayList<>();
        quartersByYear.forEach((fiscalYear, quarters) -> {
            Double annual = annualByYear.get(fiscalYear);
            if (quarters.size() != 4 || annual == null || annual == 0) {
                return;
            }
            double sum = quarters.values().stream().mapToDouble(Double::doubleValue).sum();
            double deviation = Math.abs(sum - annual) / Math.abs(annual);
            if (deviation > QUARTERLY_SUM_TOLERANCE) {
                warnings.add(Warning.of(WarningCode.QUARTERLY_SUM_MISMATCH, series.metric(), String.format(Locale.ROOT,
                    "%s FY%d: quarters sum to %.0f but annual is %.0f (%.1f%% apart)",
                    series.metric().metricName(), fiscalYear, sum, annual, deviation * 100)));
            }
        });
        return warnings;
    }

    Optional<Warning> checkBalanceSheet(Map<LogicalMetric, ConceptSeries> series) {
        Map<LocalDate, Double> assets = balances(series.get(LogicalMetric.TOTAL_ASSETS));
        Map<LocalDate, Double> liabilities = balances(series.get(LogicalMetric.TOTAL_LIABILITIES));
        Map<LocalDate, Double> equity = balances(series.get(LogicalMetric.STOCKHOLDERS_EQUITY));

        Optional<LocalDate> latestCommon = assets.keySet().stream()
            .filter(liabilities::containsKey)
            .filter(equity::containsKey)
            .max(LocalDate::compareTo);
        if (latestCommon.isEmpty()) {
            return Optional.empty();
        }

        LocalDate date = latestCommon.get();
        double totalAssets = assets.get(date);
        if (totalAssets == 0) {
            return Optional.empty();
        }
        double claims = liabilities.get(date) + equity.get(date);
        double deviation = Math.abs(totalAssets - claims) / Math.abs(totalAssets);
        if (deviation <= BALANCE_SHEET_TOLERANCE) {
            return Optional.empty();
        }
        return Optional.of(Warning.of(WarningCode.BALANCE_SHEET_MISMATCH, LogicalMetric.TOTAL_ASSETS, String.format(
            Locale.ROOT, "Assets %.0f vs liabilities + equity %.0f at %s (%.1f%% apart)",
            totalAssets, claims, date, deviation * 100)));
    }

    private static Map<LocalDate, Double> balances(ConceptSeries series) {
        Map<LocalDate, Double> byDate = new HashMap<>();
        if (series != null) {
            for (ClassifiedFact entry : series.bucket(PeriodBucket.POINT_IN_TIME)) {
                byDate.put(entry.periodEnd(), entry.value());
            }
        }
        return byDate;
    }
}
