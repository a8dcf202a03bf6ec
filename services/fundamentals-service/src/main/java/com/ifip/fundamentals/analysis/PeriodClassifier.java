package com.ifip.fundamentals.analysis;

import com.ifip.fundamentals.config.FundamentalsProperties;
import com.ifip.fundamentals.domain.ClassifiedFact;
import com.ifip.fundamentals.domain.ConceptSeries;
import com.ifip.fundamentals.domain.LogicalMetric;
import com.ifip.fundamentals.domain.PeriodBucket;
import com.ifip.fundamentals.domain.RawFact;
import com.ifip.fundamentals.domain.Warning;
import com.ifip.fundamentals.domain.WarningCode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/**
 * Sorts the facts of one concept into quarterly, year-to-date, annual and point-in-time buckets.
 *
 * <p>XBRL does not say whether a 10-Q value covers the quarter or the fiscal year so far. Values
 * are grouped by reporting period; 10-K groups are annual, the first fiscal quarter of each year
 * is quarterly and becomes that year's baseline, and later 10-Q values far above the baseline at
 * the fiscal year-end month are treated as cumulative. A reported period start overrides the
 * ratio test either way: more than one quarter is cumulative, one quarter stays discrete.
 *
 * <p>Most 10-Ks only carry the fiscal-year total. Quarters that were only reported inside
 * cumulative totals are derived by subtraction (Q4 = year less the 9-month total, and likewise for
 * Q2 and Q3). Derived quarters sit in the quarterly bucket but not in {@code all}, which holds
 * reported facts only.
 *
 * <p>Classification never fails: doubtful cases get a best-guess bucket, a lower confidence and
 * a warning.
 */
@Component
public class PeriodClassifier {

    static final long MAX_QUARTER_DAYS = 120;
    static final long MIN_ANNUAL_DAYS = 300;

    private static final Comparator<RawFact> FILING_ORDER = Comparator
        .comparing(RawFact::filedDate)
        .thenComparing(f -> Objects.toString(f.accessionNo(), ""))
        .thenComparing(f -> Objects.toString(f.formType(), ""))
        .thenComparingDouble(RawFact::value);

    private static final Comparator<RawFact> PERIOD_ORDER = Comparator
        .comparing(RawFact::periodEnd)
        .thenComparing(RawFact::periodStart, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(FILING_ORDER);

    private final double ytdRatioThreshold;
    private final double scaleMismatchMultiple;

    public PeriodClassifier(FundamentalsProperties properties) {
        this.ytdRatioThreshold = properties.getYtdRatioThreshold();
        this.scaleMismatchMultiple = properties.getScaleMismatchMultiple();
    }

    public ConceptSeries classify(LogicalMetric metric, String concept, List<RawFact> facts) {
        return classify(metric, concept, facts, FiscalCalendar.detect(facts));
    }

    public ConceptSeries classify(LogicalMetric metric, String concept, List<RawFact> facts, FiscalCalendar calendar) {
        List<Warning> warnings = new ArrayList<>();
        List<ClassifiedFact> decided = metric.isInstant()
            ? classifyInstants(facts)
            : classifyDurations(metric, facts, calendar, warnings);

        Map<PeriodBucket, List<ClassifiedFact>> buckets = authoritativeByPeriodEnd(decided);
        List<ClassifiedFact> all = decided.stream()
            .map(c -> isAuthoritative(c, buckets) ? c : c.withReason(c.reason() + "; superseded by a later filing"))
            .sorted(Comparator.comparing(ClassifiedFact::fact, PERIOD_ORDER))
            .toList();

        if (!metric.isInstant()) {
            List<ClassifiedFact> quarterly = new ArrayList<>(buckets.get(PeriodBucket.QUARTERLY));
            quarterly.addAll(deriveMissingQuarters(buckets, calendar));
            quarterly.sort(Comparator.comparing(ClassifiedFact::periodEnd));
            buckets.put(PeriodBucket.QUARTERLY, List.copyOf(quarterly));
        }
        checkScale(metric, buckets.get(PeriodBucket.QUARTERLY), warnings);

        return new ConceptSeries(
            metric,
            concept,
            calendar.fiscalYearEndMonth(),
            all,
            buckets.get(PeriodBucket.QUARTERLY),
            buckets.get(PeriodBucket.ANNUAL),
            buckets.get(PeriodBucket.YTD),
            buckets.get(PeriodBucket.POINT_IN_TIME),
            warnings
        );
    }

    private List<ClassifiedFact> classifyInstants(List<RawFact> facts) {
        return facts.stream()
            .map(f -> new ClassifiedFact(f, PeriodBucket.POINT_IN_TIME, 1.0, "balance measured at " + f.periodEnd()))
            .toList();
    }

    private List<ClassifiedFact> classifyDurations(
        LogicalMetric metric,
        List<RawFact> facts,
        FiscalCalendar calendar,
        List<Warning> warnings
    ) {
        Map<PeriodKey, List<RawFact>> groups = new TreeMap<>();
        for (RawFact fact : facts) {
            groups.computeIfAbsent(new PeriodKey(fact.periodStart(), fact.periodEnd()), k -> new ArrayList<>()).add(fact);
        }

        Map<PeriodKey, Decision> decisions = new HashMap<>();
        Map<Integer, Double> baselines = new HashMap<>();
        List<PeriodKey> pending = new ArrayList<>();

        // annual groups and first-quarter baselines first, so later quarters can be measured against them
        for (Map.Entry<PeriodKey, List<RawFact>> group : groups.entrySet()) {
            RawFact representative = latestFiled(group.getValue());
            RawFact original = earliestFiled(group.getValue());
            long days = representative.durationDays();

            if (original.isAnnualForm()) {
                decisions.put(group.getKey(), annualFormDecision(original, days));
            } else if (days >= MIN_ANNUAL_DAYS) {
                decisions.put(group.getKey(), new Decision(PeriodBucket.ANNUAL, 0.8,
                    days + "-day period reported on " + original.formType()));
            } else if (calendar.fiscalQuarter(representative.periodEnd()) == 1 && days <= MAX_QUARTER_DAYS) {
                int fiscalYear = calendar.fiscalYear(representative.periodEnd());
                baselines.merge(fiscalYear, representative.value(), (existing, candidate) -> candidate);
                decisions.put(group.getKey(), new Decision(PeriodBucket.QUARTERLY, 0.95,
                    "first fiscal quarter of FY" + fiscalYear + " on " + original.formType() + "; Q1 baseline"));
            } else {
                pending.add(group.getKey());
            }
        }

        TreeSet<Integer> yearsWithoutBaseline = new TreeSet<>();
        for (PeriodKey key : pending) {
            RawFact representative = latestFiled(groups.get(key));
            decisions.put(key, laterQuarterDecision(metric, representative, calendar, baselines, yearsWithoutBaseline, warnings));
        }
        for (Integer fiscalYear : yearsWithoutBaseline) {
            Double baseline = baselines.get(fiscalYear);
            String detail = baseline == null
                ? "no first-quarter filing"
                : "first-quarter value " + baseline + " cannot anchor a ratio";
            warnings.add(Warning.of(WarningCode.NO_BASELINE, metric,
                metric.metricName() + " FY" + fiscalYear + ": " + detail + "; later quarters kept as quarterly with low confidence"));
        }

        List<ClassifiedFact> classified = new ArrayList<>(facts.size());
        for (Map.Entry<PeriodKey, List<RawFact>> group : groups.entrySet()) {
            Decision decision = decisions.get(group.getKey());
            for (RawFact fact : group.getValue()) {
                classified.add(new ClassifiedFact(fact, decision.bucket(), decision.confidence(), decision.reason()));
            }
        }
        return classified;
    }

    private Decision annualFormDecision(RawFact original, long days) {
        if (days >= 0 && days <= MAX_QUARTER_DAYS) {
            return new Decision(PeriodBucket.QUARTERLY, 0.9,
                "discrete " + days + "-day quarter reported on " + original.formType());
        }
        if (days >= 0 && days < MIN_ANNUAL_DAYS) {
            return new Decision(PeriodBucket.ANNUAL, 0.7,
                "short " + days + "-day fiscal year reported on " + original.formType());
        }
        return new Decision(PeriodBucket.ANNUAL, 1.0, "reported on " + original.formType());
    }

    private Decision laterQuarterDecision(
        LogicalMetric metric,
        RawFact fact,
        FiscalCalendar calendar,
        Map<Integer, Double> baselines,
        TreeSet<Integer> yearsWithoutBaseline,
        List<Warning> warnings
    ) {
        int fiscalYear = calendar.fiscalYear(fact.periodEnd());
        int fiscalQuarter = calendar.fiscalQuarter(fact.periodEnd());
        long days = fact.durationDays();
        boolean cumulativeDuration = days > MAX_QUARTER_DAYS;
        String position = "FY" + fiscalYear + " Q" + fiscalQuarter;

        Double baseline = baselines.get(fiscalYear);
        if (baseline == null || baseline <= 0) {
            if (cumulativeDuration) {
                return new Decision(PeriodBucket.YTD, 0.9, position + ": " + days + "-day period covers more than one quarter");
            }
            yearsWithoutBaseline.add(fiscalYear);
            return new Decision(PeriodBucket.QUARTERLY, 0.5, position + ": no usable Q1 baseline, assumed discrete quarter");
        }

        double ratio = fact.value() / baseline;
        String ratioText = String.format(Locale.ROOT, "%.2fx Q1 baseline", ratio);
        boolean looksCumulative = ratio >= ytdRatioThreshold && calendar.isFinalQuarterMonth(fact.periodEnd());
        if (looksCumulative && days >= 0 && days <= MAX_QUARTER_DAYS) {
            warnings.add(Warning.of(WarningCode.OUTSIZED_QUARTER, metric, String.format(Locale.ROOT,
                "%s %s: %d-day quarter at %s kept as quarterly", metric.metricName(), position, days, ratioText)));
            return new Decision(PeriodBucket.QUARTERLY, 0.8,
                position + ": reported " + days + "-day period overrides " + ratioText + ", discrete quarter");
        }
        if (looksCumulative) {
            return new Decision(PeriodBucket.YTD, 0.9,
                position + ": " + ratioText + " at fiscal year-end month " + calendar.finalQuarterMonth() + ", cumulative");
        }
        if (cumulativeDuration) {
            return new Decision(PeriodBucket.YTD, 0.95, position + ": " + days + "-day period covers more than one quarter (" + ratioText + ")");
        }
        return new Decision(PeriodBucket.QUARTERLY, days >= 0 ? 0.95 : 0.85, position + ": " + ratioText + ", discrete quarter");
    }

    private List<ClassifiedFact> deriveMissingQuarters(Map<PeriodBucket, List<ClassifiedFact>> buckets, FiscalCalendar calendar) {
        Map<Integer, ClassifiedFact[]> discrete = new TreeMap<>();
        Map<Integer, ClassifiedFact[]> totals = new TreeMap<>();
        for (ClassifiedFact quarter : buckets.get(PeriodBucket.QUARTERLY)) {
            slot(discrete, calendar, quarter);
        }
        for (ClassifiedFact year : buckets.get(PeriodBucket.ANNUAL)) {
            if (calendar.fiscalQuarter(year.periodEnd()) == 4 && startsFiscalYear(year, calendar)) {
                slot(totals, calendar, year);
            }
        }
        for (ClassifiedFact ytd : buckets.get(PeriodBucket.YTD)) {
            if (startsFiscalYear(ytd, calendar)) {
                slot(totals, calendar, ytd);
            }
        }

        List<ClassifiedFact> derived = new ArrayList<>();
        for (Map.Entry<Integer, ClassifiedFact[]> year : totals.entrySet()) {
            int fiscalYear = year.getKey();
            ClassifiedFact[] cumulative = year.getValue();
            ClassifiedFact[] quarters = discrete.computeIfAbsent(fiscalYear, k -> new ClassifiedFact[5]);
            for (int q = 2; q <= 4; q++) {
                ClassifiedFact total = cumulative[q];
                if (quarters[q] != null || total == null) {
                    continue;
                }
                RunningTotal previous = runningTotal(quarters, cumulative, q - 1);
                if (previous == null || !previous.end().isBefore(total.periodEnd())) {
                    continue;
                }
                RawFact source = total.fact();
                LocalDate filed = source.filedDate().isAfter(previous.filed()) ? source.filedDate() : previous.filed();
                RawFact fact = new RawFact(source.concept(), source.unit(), source.value() - previous.value(),
                    previous.end().plusDays(1), total.periodEnd(), filed, source.formType(), null, null, source.accessionNo());
                String totalLabel = q == 4 ? "fiscal year total" : (q * 3) + "-month YTD";
                quarters[q] = new ClassifiedFact(fact, PeriodBucket.QUARTERLY,
                    Math.min(0.75, Math.min(total.confidence(), previous.confidence())),
                    "derived: FY" + fiscalYear + " Q" + q + " = " + totalLabel + " minus " + previous.label());
                derived.add(quarters[q]);
            }
        }
        return derived;
    }

    /**
     * Value reported for the fiscal year through quarter {@code q}, or null when it is unknown.
     */
    private static RunningTotal runningTotal(ClassifiedFact[] quarters, ClassifiedFact[] cumulative, int q) {
        if (q == 1 && quarters[1] != null) {
            return new RunningTotal(quarters[1].value(), quarters[1].periodEnd(), quarters[1].fact().filedDate(),
                quarters[1].confidence(), "Q1");
        }
        if (q > 1 && cumulative[q] != null) {
            ClassifiedFact total = cumulative[q];
            return new RunningTotal(total.value(), total.periodEnd(), total.fact().filedDate(), total.confidence(),
                (q * 3) + "-month YTD");
        }
        double sum = 0;
        double confidence = 1.0;
        LocalDate filed = LocalDate.MIN;
        for (int i = 1; i <= q; i++) {
            if (quarters[i] == null) {
                return null;
            }
            sum += quarters[i].value();
            confidence = Math.min(confidence, quarters[i].confidence());
            filed = quarters[i].fact().filedDate().isAfter(filed) ? quarters[i].fact().filedDate() : filed;
        }
        return new RunningTotal(sum, quarters[q].periodEnd(), filed, confidence, "Q1-Q" + q + " sum");
    }

    private static void slot(Map<Integer, ClassifiedFact[]> byYear, FiscalCalendar calendar, ClassifiedFact entry) {
        ClassifiedFact[] slots = byYear.computeIfAbsent(calendar.fiscalYear(entry.periodEnd()), k -> new ClassifiedFact[5]);
        int quarter = calendar.fiscalQuarter(entry.periodEnd());
        if (slots[quarter] == null) {
            slots[quarter] = entry;
        }
    }

    private static boolean startsFiscalYear(ClassifiedFact entry, FiscalCalendar calendar) {
        LocalDate start = entry.fact().periodStart();
        if (start == null) {
            return true;
        }
        LocalDate dayBefore = start.minusDays(1);
        return calendar.fiscalQuarter(dayBefore) == 4
            && calendar.fiscalYear(dayBefore) == calendar.fiscalYear(entry.periodEnd()) - 1;
    }

    /**
     * Keeps, per bucket, one entry per period end: the one filed last.
     */
    private Map<PeriodBucket, List<ClassifiedFact>> authoritativeByPeriodEnd(List<ClassifiedFact> decided) {
        Map<PeriodBucket, Map<LocalDate, ClassifiedFact>> winners = new EnumMap<>(PeriodBucket.class);
        for (PeriodBucket bucket : PeriodBucket.values()) {
            winners.put(bucket, new TreeMap<>());
        }
        for (ClassifiedFact candidate : decided) {
            winners.get(candidate.bucket()).merge(candidate.periodEnd(), candidate,
                (current, challenger) -> FILING_ORDER.compare(challenger.fact(), current.fact()) > 0 ? challenger : current);
        }

        Map<PeriodBucket, List<ClassifiedFact>> buckets = new EnumMap<>(PeriodBucket.class);
        winners.forEach((bucket, byEnd) -> buckets.put(bucket, List.copyOf(byEnd.values())));
        return buckets;
    }

    private boolean isAuthoritative(ClassifiedFact candidate, Map<PeriodBucket, List<ClassifiedFact>> buckets) {
        for (ClassifiedFact winner : buckets.get(candidate.bucket())) {
            if (winner == candidate) {
                return true;
            }
        }
        return false;
    }

    private void checkScale(LogicalMetric metric, List<ClassifiedFact> quarterly, List<Warning> warnings) {
        double max = 0;
        double min = Double.MAX_VALUE;
        for (ClassifiedFact entry : quarterly) {
            double magnitude = Math.abs(entry.value());
            if (magnitude == 0) {
                continue;
            }
            max = Math.max(max, magnitude);
            min = Math.min(min, magnitude);
        }
        if (max == 0 || min == Double.MAX_VALUE) {
            return;
        }
        double spread = max / min;
        if (spread > scaleMismatchMultiple) {
            warnings.add(Warning.of(WarningCode.SCALE_MISMATCH, metric, String.format(Locale.ROOT,
                "%s quarterly values span %.0fx (max %.0f, min %.0f); possible unit/scale mismatch",
                metric.metricName(), spread, max, min)));
        }
    }

    private static RawFact latestFiled(List<RawFact> facts) {
        return facts.stream().max(FILING_ORDER).orElseThrow();
    }

    private static RawFact earliestFiled(List<RawFact> facts) {
        return facts.stream().min(FILING_ORDER).orElseThrow();
    }

    private record RunningTotal(double value, LocalDate end, LocalDate filed, double confidence, String label) {
    }

    private record Decision(PeriodBucket bucket, double confidence, String reason) {
    }

    private record PeriodKey(LocalDate start, LocalDate end) implements Comparable<PeriodKey> {

        private static final Comparator<PeriodKey> ORDER = Comparator
            .comparing(PeriodKey::end)
            .thenComparing(PeriodKey::start, Comparator.nullsFirst(Comparator.naturalOrder()));

        @Override
        public int compareTo(PeriodKey other) {
            return ORDER.compare(this, other);
        }
    }
}
