package com.ifip.fundamentals.analysis;

import com.ifip.fundamentals.config.FundamentalsProperties;
import com.ifip.fundamentals.domain.ClassifiedFact;
import com.ifip.fundamentals.domain.ConceptSeries;
import com.ifip.fundamentals.domain.GrowthKind;
import com.ifip.fundamentals.domain.GrowthMetric;
import com.ifip.fundamentals.domain.PeriodBucket;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Year-over-year and quarter-over-quarter growth, always between entries of the same bucket.
 *
 * <p>YoY pairs the latest entry of a bucket with the entry one fiscal year earlier at the same
 * fiscal quarter. QoQ only ever pairs two consecutive quarterly entries.
 */
@Component
public class GrowthCalculator {

    private static final List<PeriodBucket> YOY_BUCKETS = List.of(
        PeriodBucket.QUARTERLY,
        PeriodBucket.YTD,
        PeriodBucket.ANNUAL,
        PeriodBucket.POINT_IN_TIME
    );

    private final double flagCeilingPct;

    public GrowthCalculator(FundamentalsProperties properties) {
        this.flagCeilingPct = properties.getGrowthFlagCeilingPct();
    }

    public List<GrowthMetric> calculate(ConceptSeries series) {
        FiscalCalendar calendar = FiscalCalendar.ofYearEndMonth(series.fiscalYearEndMonth());
        String metricName = series.metric().metricName();
        List<GrowthMetric> results = new ArrayList<>();

        for (PeriodBucket bucket : YOY_BUCKETS) {
            List<ClassifiedFact> entries = series.bucket(bucket);
            if (entries.isEmpty()) {
                continue;
            }
            ClassifiedFact current = entries.get(entries.size() - 1);
            Optional<ClassifiedFact> previous = priorYearCounterpart(entries, current, calendar);
            results.add(compare(metricName, GrowthKind.YOY, bucket, current, previous.orElse(null)));
        }

        List<ClassifiedFact> quarterly = series.quarterly();
        if (!quarterly.isEmpty()) {
            ClassifiedFact current = quarterly.get(quarterly.size() - 1);
            ClassifiedFact previous = quarterly.size() > 1 ? quarterly.get(quarterly.size() - 2) : null;
            results.add(compare(metricName, GrowthKind.QOQ, PeriodBucket.QUARTERLY, current, previous));
        }
        return results;
    }

    /**
     * {@code (current - previous) / |previous| * 100}, or null when the comparison has no meaning.
     */
    static Double growthPct(double current, double previous) {
        if (previous == 0 || (current != 0 && Math.signum(current) != Math.signum(previous))) {
            return null;
        }
        return (current - previous) / Math.abs(previous) * 100.0;
    }

    private Optional<ClassifiedFact> priorYearCounterpart(
        List<ClassifiedFact> entries,
        ClassifiedFact current,
        FiscalCalendar calendar
    ) {
        int targetYear = calendar.fiscalYear(current.periodEnd()) - 1;
        int targetQuarter = calendar.fiscalQuarter(current.periodEnd());
        ClassifiedFact match = null;
        for (ClassifiedFact candidate : entries) {
            if (calendar.fiscalYear(candidate.periodEnd()) == targetYear
                && calendar.fiscalQuarter(candidate.periodEnd()) == targetQuarter) {
                match = candidate;
            }
        }
        return Optional.ofNullable(match);
    }

    private GrowthMetric compare(
        String metricName,
        GrowthKind kind,
        PeriodBucket bucket,
        ClassifiedFact current,
        ClassifiedFact previous
    ) {
        if (previous == null) {
            return new GrowthMetric(metricName, kind, bucket, current.periodEnd(), null, current.value(),
                null, null, false, false);
        }
        Double pct = growthPct(current.value(), previous.value());
        boolean flagged = pct != null && Math.abs(pct) > flagCeilingPct;
        return new GrowthMetric(metricName, kind, bucket, current.periodEnd(), previous.periodEnd(),
            current.value(), previous.value(), pct, pct != null, flagged);
    }
}
