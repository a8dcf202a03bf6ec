package com.ifip.fundamentals.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.ifip.fundamentals.domain.ClassifiedFact;
import com.ifip.fundamentals.domain.ConceptSeries;
import com.ifip.fundamentals.domain.Grade;
import com.ifip.fundamentals.domain.LogicalMetric;
import com.ifip.fundamentals.domain.PeriodBucket;
import com.ifip.fundamentals.domain.QualityReport;
import com.ifip.fundamentals.domain.Warning;
import com.ifip.fundamentals.domain.WarningCode;
import com.ifip.fundamentals.support.Facts;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("QualityScorer")
class QualityScorerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-02-15T00:00:00Z"), ZoneOffset.UTC);

    private QualityScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new QualityScorer(CLOCK);
    }

    private static ConceptSeries quarters(LogicalMetric metric, int count, String lastEnd) {
        List<ClassifiedFact> entries = new ArrayList<>();
        LocalDate end = LocalDate.parse(lastEnd);
        for (int i = count - 1; i >= 0; i--) {
            LocalDate periodEnd = end.minusMonths(3L * i);
            entries.add(Facts.classified(
                Facts.duration(metric.aliases().get(0), periodEnd.minusMonths(3).plusDays(1).toString(), periodEnd.toString(), 100, "10-Q"),
                PeriodBucket.QUARTERLY));
        }
        return Facts.series(metric, entries);
    }

    private static ConceptSeries balance(LogicalMetric metric, String end) {
        return Facts.series(metric, List.of(
            Facts.classified(Facts.instant(metric.aliases().get(0), end, 100, "10-Q"), PeriodBucket.POINT_IN_TIME)));
    }

    private static Map<LogicalMetric, ConceptSeries> allCore(int revenueQuarters, String lastEnd) {
        Map<LogicalMetric, ConceptSeries> series = new EnumMap<>(LogicalMetric.class);
        series.put(LogicalMetric.REVENUE, quarters(LogicalMetric.REVENUE, revenueQuarters, lastEnd));
        series.put(LogicalMetric.NET_INCOME, quarters(LogicalMetric.NET_INCOME, 1, lastEnd));
        series.put(LogicalMetric.TOTAL_ASSETS, balance(LogicalMetric.TOTAL_ASSETS, lastEnd));
        series.put(LogicalMetric.TOTAL_LIABILITIES, balance(LogicalMetric.TOTAL_LIABILITIES, lastEnd));
        series.put(LogicalMetric.STOCKHOLDERS_EQUITY, balance(LogicalMetric.STOCKHOLDERS_EQUITY, lastEnd));
        return series;
    }

    @Nested
    @DisplayName("Sub-scores")
    class SubScores {

        @Test
        @DisplayName("should give a complete, fresh, well-covered company an A+")
        void score_completeFreshCompany_isAPlus() {
            // Given
            Map<LogicalMetric, ConceptSeries> series = allCore(8, "2023-12-31");

            // When
            QualityReport report = scorer.score("AAPL", "Apple Inc.", series);

            // Then
            assertThat(report.completenessScore()).isEqualTo(100.0);
            assertThat(report.freshnessScore()).isEqualTo(100.0);
            assertThat(report.dataQualityScore()).isEqualTo(100.0);
            assertThat(report.penalty()).isZero();
            assertThat(report.overallScore()).isEqualTo(100.0);
            assertThat(report.grade()).isEqualTo(Grade.A_PLUS);
        }

        @Test
        @DisplayName("should count only core metrics with usable data toward completeness")
        void completeness_countsCoreMetricsOnly() {
            Map<LogicalMetric, ConceptSeries> series = allCore(8, "2023-12-31");
            series.remove(LogicalMetric.TOTAL_LIABILITIES);
            series.put(LogicalMetric.CASH, balance(LogicalMetric.CASH, "2023-12-31"));
            series.put(LogicalMetric.STOCKHOLDERS_EQUITY, Facts.series(LogicalMetric.STOCKHOLDERS_EQUITY, List.of()));

            assertThat(QualityScorer.completeness(series)).isEqualTo(60.0);
        }

        @ParameterizedTest(name = "{0} days old -> {1}")
        @CsvSource({"0, 100", "91, 100", "92, 85", "182, 85", "183, 60", "365, 60", "366, 30", "2000, 30"})
        void freshness_tiers(long daysOld, double expected) {
            LocalDate latest = LocalDate.now(CLOCK).minusDays(daysOld);

            assertThat(scorer.freshness(Optional.of(latest))).isEqualTo(expected);
        }

        @Test
        @DisplayName("should score freshness zero when nothing was classified")
        void freshness_withoutData_isZero() {
            assertThat(scorer.freshness(Optional.empty())).isZero();
        }

        @ParameterizedTest(name = "{0} quarters -> {1}")
        @CsvSource({"0, 0", "1, 30", "2, 50", "3, 50", "4, 70", "5, 70", "6, 85", "7, 85", "8, 100", "40, 100"})
        void dataQuality_tiers(int points, double expected) {
            assertThat(QualityScorer.dataQualityForPoints(points)).isEqualTo(expected);
        }

        @Test
        @DisplayName("should put a single quarterly point in the lowest non-zero tier")
        void dataQuality_singlePoint() {
            Map<LogicalMetric, ConceptSeries> series = Map.of(
                LogicalMetric.REVENUE, quarters(LogicalMetric.REVENUE, 1, "2023-12-31"));

            assertThat(QualityScorer.dataQuality(series)).isEqualTo(30.0);
        }
    }

    @Nested
    @DisplayName("Composite")
    class Composite {

        @Test
        @DisplayName("should deduct 10 points per scale-mismatched series, at most 30")
        void score_penalisesScaleMismatch() {
            // Given
            Map<LogicalMetric, ConceptSeries> series = allCore(8, "2023-12-31");
            Warning mismatch = Warning.of(WarningCode.SCALE_MISMATCH, LogicalMetric.REVENUE, "scale");
            for (LogicalMetric metric : List.of(LogicalMetric.REVENUE, LogicalMetric.NET_INCOME, LogicalMetric.TOTAL_ASSETS,
                LogicalMetric.TOTAL_LIABILITIES)) {
                ConceptSeries s = series.get(metric);
                series.put(metric, new ConceptSeries(s.metric(), s.concept(), s.fiscalYearEndMonth(), s.all(), s.quarterly(),
                    s.annual(), s.ytd(), s.pointInTime(), List.of(mismatch)));
            }

            // When
            QualityReport report = scorer.score("X", "X Corp", series);

            // Then
            assertThat(report.penalty()).isEqualTo(30.0);
            assertThat(report.overallScore()).isCloseTo(70.0, within(1e-9));
            assertThat(report.grade()).isEqualTo(Grade.C);
        }

        @Test
        @DisplayName("should grade a company without data F")
        void score_withoutData_isF() {
            QualityReport report = scorer.score("X", "X Corp", Map.of());

            assertThat(report.overallScore()).isZero();
            assertThat(report.grade()).isEqualTo(Grade.F);
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({"100, A+", "95, A+", "94.9, A", "90, A", "85, B+", "80, B", "75, C+", "70, C", "60, D", "59.9, F", "0, F"})
        void grade_thresholds(double score, String label) {
            assertThat(Grade.forScore(score).label()).isEqualTo(label);
        }
    }
}
