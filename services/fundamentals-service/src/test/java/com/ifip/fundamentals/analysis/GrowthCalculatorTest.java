package com.ifip.fundamentals.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.ifip.fundamentals.domain.ClassifiedFact;
import com.ifip.fundamentals.domain.ConceptSeries;
import com.ifip.fundamentals.domain.GrowthKind;
import com.ifip.fundamentals.domain.GrowthMetric;
import com.ifip.fundamentals.domain.LogicalMetric;
import com.ifip.fundamentals.domain.PeriodBucket;
import com.ifip.fundamentals.support.Facts;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("GrowthCalculator")
class GrowthCalculatorTest {

    private GrowthCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new GrowthCalculator(Facts.properties());
    }

    private static ClassifiedFact quarter(String start, String end, double value) {
        return Facts.classified(Facts.duration("Revenues", start, end, value, "10-Q"), PeriodBucket.QUARTERLY);
    }

    private static GrowthMetric find(List<GrowthMetric> metrics, GrowthKind kind, PeriodBucket bucket) {
        return metrics.stream()
            .filter(m -> m.kind() == kind && m.bucket() == bucket)
            .findFirst()
            .orElseThrow();
    }

    @Nested
    @DisplayName("Year over year")
    class YearOverYear {

        @Test
        @DisplayName("should compare the latest quarter with the same fiscal quarter a year earlier")
        void shouldMatchSameFiscalQuarter() {
            // Given
            ConceptSeries series = Facts.series(LogicalMetric.REVENUE, List.of(
                quarter("2022-04-01", "2022-06-30", 100),
                quarter("2022-07-01", "2022-09-30", 500),
                quarter("2023-01-01", "2023-03-31", 110),
                quarter("2023-04-01", "2023-06-30", 120)
            ));

            // When
            GrowthMetric yoy = find(calculator.calculate(series), GrowthKind.YOY, PeriodBucket.QUARTERLY);

            // Then
            assertThat(yoy.currentPeriod()).isEqualTo(LocalDate.parse("2023-06-30"));
            assertThat(yoy.previousPeriod()).isEqualTo(LocalDate.parse("2022-06-30"));
            assertThat(yoy.growthPct()).isCloseTo(20.0, within(1e-9));
            assertThat(yoy.meaningful()).isTrue();
            assertThat(yoy.flagged()).isFalse();
        }

        @Test
        @DisplayName("should compare annual totals only with annual totals")
        void shouldCompareAnnualWithAnnual() {
            ConceptSeries series = Facts.series(LogicalMetric.REVENUE, List.of(
                Facts.classified(Facts.duration("Revenues", "2022-01-01", "2022-12-31", 400, "10-K"), PeriodBucket.ANNUAL),
                Facts.classified(Facts.duration("Revenues", "2023-01-01", "2023-12-31", 300, "10-K"), PeriodBucket.ANNUAL),
                quarter("2023-10-01", "2023-12-31", 90)
            ));

            GrowthMetric yoy = find(calculator.calculate(series), GrowthKind.YOY, PeriodBucket.ANNUAL);

            assertThat(yoy.previousValue()).isEqualTo(400.0);
            assertThat(yoy.growthPct()).isCloseTo(-25.0, within(1e-9));
        }

        @Test
        @DisplayName("should not be meaningful without a prior-year entry")
        void shouldNotBeMeaningfulWithoutPriorYear() {
            ConceptSeries series = Facts.series(LogicalMetric.REVENUE, List.of(
                quarter("2023-01-01", "2023-03-31", 100),
                quarter("2023-04-01", "2023-06-30", 110)
            ));

            GrowthMetric yoy = find(calculator.calculate(series), GrowthKind.YOY, PeriodBucket.QUARTERLY);

            assertThat(yoy.meaningful()).isFalse();
            assertThat(yoy.previousPeriod()).isNull();
            assertThat(yoy.growthPct()).isNull();
        }
    }

    @Nested
    @DisplayName("Quarter over quarter")
    class QuarterOverQuarter {

        @Test
        @DisplayName("should only pair consecutive quarterly entries")
        void shouldIgnoreYtdAndAnnualEntries() {
            // Given: a year-to-date total sits between the two quarters
            ConceptSeries series = Facts.series(LogicalMetric.REVENUE, List.of(
                quarter("2023-01-01", "2023-03-31", 100),
                Facts.classified(Facts.withoutStart("Revenues", "2023-06-30", 900, "10-Q"), PeriodBucket.YTD),
                quarter("2023-07-01", "2023-09-30", 110)
            ));

            // When
            GrowthMetric qoq = find(calculator.calculate(series), GrowthKind.QOQ, PeriodBucket.QUARTERLY);

            // Then
            assertThat(qoq.previousPeriod()).isEqualTo(LocalDate.parse("2023-03-31"));
            assertThat(qoq.previousValue()).isEqualTo(100.0);
            assertThat(qoq.growthPct()).isCloseTo(10.0, within(1e-9));
        }

        @Test
        @DisplayName("should not be meaningful for a single data point")
        void shouldHandleSinglePoint() {
            ConceptSeries series = Facts.series(LogicalMetric.REVENUE, List.of(quarter("2023-01-01", "2023-03-31", 100)));

            List<GrowthMetric> metrics = calculator.calculate(series);

            assertThat(metrics).isNotEmpty().allSatisfy(m -> assertThat(m.meaningful()).isFalse());
            assertThat(find(metrics, GrowthKind.QOQ, PeriodBucket.QUARTERLY).currentValue()).isEqualTo(100.0);
        }

        @Test
        @DisplayName("should flag growth above the ceiling but keep the number")
        void shouldFlagExtremeGrowth() {
            ConceptSeries series = Facts.series(LogicalMetric.REVENUE, List.of(
                quarter("2023-01-01", "2023-03-31", 100),
                quarter("2023-04-01", "2023-06-30", 450)
            ));

            GrowthMetric qoq = find(calculator.calculate(series), GrowthKind.QOQ, PeriodBucket.QUARTERLY);

            assertThat(qoq.flagged()).isTrue();
            assertThat(qoq.meaningful()).isTrue();
            assertThat(qoq.growthPct()).isCloseTo(350.0, within(1e-9));
        }
    }

    @Nested
    @DisplayName("Guards")
    class Guards {

        @Test
        @DisplayName("should refuse a zero previous value")
        void growthPct_zeroPrevious_isNull() {
            assertThat(GrowthCalculator.growthPct(10, 0)).isNull();
        }

        @Test
        @DisplayName("should refuse a sign change")
        void growthPct_oppositeSigns_isNull() {
            assertThat(GrowthCalculator.growthPct(10, -5)).isNull();
            assertThat(GrowthCalculator.growthPct(-10, 5)).isNull();
        }

        @Test
        @DisplayName("should divide by the magnitude of a negative previous value")
        void growthPct_bothNegative_usesAbsoluteDenominator() {
            assertThat(GrowthCalculator.growthPct(-50, -100)).isCloseTo(50.0, within(1e-9));
        }

        @Test
        @DisplayName("should report a drop to zero as -100%")
        void growthPct_dropToZero() {
            assertThat(GrowthCalculator.growthPct(0, 80)).isCloseTo(-100.0, within(1e-9));
        }
    }
}
