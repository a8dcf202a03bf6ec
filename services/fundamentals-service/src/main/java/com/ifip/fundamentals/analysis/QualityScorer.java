package com.ifip.fundamentals.analysis;

import com.ifip.fundamentals.domain.ClassifiedFact;
import com.ifip.fundamentals.domain.ConceptSeries;
import com.ifip.fundamentals.domain.Grade;
import com.ifip.fundamentals.domain.LogicalMetric;
import com.ifip.fundamentals.domain.PeriodBucket;
import com.ifip.fundamentals.domain.QualityReport;
import com.ifip.fundamentals.domain.WarningCode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Grades how far a company's fundamentals can be trusted.
 *
 * <p>Completeness, freshness and quarterly granularity are scored separately on a 0-100 scale and
 * blended 40/30/30. Each series flagged for a scale mismatch costs 10 points, at most 30.
 */
@Component
public class QualityScorer {

    static final double DAYS_PER_MONTH = 30.4375;
    static final double SCALE_MISMATCH_PENALTY = 10.0;
    static final double MAX_PENALTY = 30.0;

    private final Clock clock;

    public QualityScorer(Clock clock) {
        this.clock = clock;
    }

    public QualityReport score(String ticker, String companyName, Map<LogicalMetric, ConceptSeries> series) {
        double completeness = completeness(series);
        double freshness = freshness(latestPeriodEnd(series));
        double dataQuality = dataQuality(series);

        long mismatched = series.values().stream().filter(s -> s.hasWarning(WarningCode.SCALE_MISMATCH)).count();
        double penalty = Math.min(MAX_PENALTY, mismatched * SCALE_MISMATCH_PENALTY);

        double overall = clamp(0.4 * completeness + 0.3 * freshness + 0.3 * dataQuality - penalty);
        return new QualityReport(ticker, companyName, completeness, freshness, dataQuality, penalty, overall,
            Grade.forScore(overall));
    }

    /**
     * Report for a company whose facts could not be obtained at all.
     */
    public static QualityReport unavailable(String ticker, String companyName) {
        return new QualityReport(ticker, companyName, 0, 0, 0, 0, 0, Grade.F);
    }

    static double completeness(Map<LogicalMetric, ConceptSeries> series) {
        List<LogicalMetric> core = LogicalMetric.coreMetrics();
        long usable = core.stream()
            .map(series::get)
            .filter(s -> s != null && s.hasUsableData())
            .count();
        return usable * 100.0 / core.size();
    }

    double freshness(Optional<LocalDate> latest) {
        if (latest.isEmpty()) {
            return 0;
        }
        long days = ChronoUnit.DAYS.between(latest.get(), LocalDate.now(clock));
        double months = Math.max(0, days) / DAYS_PER_MONTH;
        if (months <= 3) {
            return 100;
        }
        if (months <= 6) {
            return 85;
        }
        if (months <= 12) {
            return 60;
        }
        return 30;
    }

    static double dataQuality(Map<LogicalMetric, ConceptSeries> series) {
        int points = LogicalMetric.coreMetrics().stream()
            .filter(m -> !m.isInstant())
            .map(series::get)
            .filter(s -> s != null)
            .mapToInt(s -> s.quarterly().size())
            .max()
            .orElse(0);
        return dataQualityForPoints(points);
    }

    static double dataQualityForPoints(int points) {
        if (points >= 8) {
            return 100;
        }
        if (points >= 6) {
            return 85;
        }
        if (points >= 4) {
            return 70;
        }
        if (points >= 2) {
            return 50;
        }
        if (points >= 1) {
            return 30;
        }
        return 0;
    }

    private static Optional<LocalDate> latestPeriodEnd(Map<LogicalMetric, ConceptSeries> series) {
        LocalDate latest = null;
        for (ConceptSeries s : series.values()) {
            for (PeriodBucket bucket : PeriodBucket.values()) {
                Optional<ClassifiedFact> entry = s.latest(bucket);
                if (entry.isPresent() && (latest == null || entry.get().periodEnd().isAfter(latest))) {
                    latest = entry.get().periodEnd();
                }
            }
        }
        return Optional.ofNullable(latest);
    }

    private static double clamp(double score) {
        return Math.max(0, Math.min(100, score));
    }
}
