package com.ifip.fundamentals.analysis;

import com.ifip.fundamentals.domain.RawFact;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A company's fiscal calendar, reduced to the month its fiscal year closes.
 *
 * <p>Period ends in the first week of a month are attributed to the previous month so that
 * 52/53-week calendars (years closing on "the last Saturday of September") land on a stable month.
 */
public final class FiscalCalendar {

    public static final int DEFAULT_YEAR_END_MONTH = 12;

    private static final int MIN_ANNUAL_DAYS = 300;
    private static final int SPILLOVER_DAYS = 7;

    private final int fiscalYearEndMonth;
    private final boolean assumed;

    private FiscalCalendar(int fiscalYearEndMonth, boolean assumed) {
        if (fiscalYearEndMonth < 1 || fiscalYearEndMonth > 12) {
            throw new IllegalArgumentException("Fiscal year-end month out of range: " + fiscalYearEndMonth);
        }
        this.fiscalYearEndMonth = fiscalYearEndMonth;
        this.assumed = assumed;
    }

    public static FiscalCalendar ofYearEndMonth(int fiscalYearEndMonth) {
        return new FiscalCalendar(fiscalYearEndMonth, false);
    }

    /**
     * Picks the period-end month that recurs most often across annual filings. Twelve-month
     * periods are preferred; annual-form instants are used when no durations were reported.
     * Ties go to the month of the most recent annual period. Without any annual filing the
     * calendar year is assumed.
     */
    public static FiscalCalendar detect(Collection<RawFact> facts) {
        List<RawFact> annualDurations = facts.stream()
            .filter(RawFact::isAnnualForm)
            .filter(f -> f.durationDays() >= MIN_ANNUAL_DAYS)
            .toList();
        List<RawFact> candidates = annualDurations.isEmpty()
            ? facts.stream().filter(RawFact::isAnnualForm).filter(f -> !f.hasDuration()).toList()
            : annualDurations;
        if (candidates.isEmpty()) {
            return new FiscalCalendar(DEFAULT_YEAR_END_MONTH, true);
        }

        Map<Integer, Integer> counts = new HashMap<>();
        Map<Integer, LocalDate> latestByMonth = new HashMap<>();
        for (RawFact fact : candidates) {
            int month = effectiveMonth(fact.periodEnd()).getMonthValue();
            counts.merge(month, 1, Integer::sum);
            latestByMonth.merge(month, fact.periodEnd(), (a, b) -> a.isAfter(b) ? a : b);
        }

        int month = counts.keySet().stream()
            .max(Comparator.<Integer>comparingInt(counts::get).thenComparing(latestByMonth::get))
            .orElse(DEFAULT_YEAR_END_MONTH);
        return new FiscalCalendar(month, false);
    }

    public static YearMonth effectiveMonth(LocalDate periodEnd) {
        YearMonth month = YearMonth.from(periodEnd);
        return periodEnd.getDayOfMonth() <= SPILLOVER_DAYS ? month.minusMonths(1) : month;
    }

    public int fiscalYearEndMonth() {
        return fiscalYearEndMonth;
    }

    public boolean isAssumed() {
        return assumed;
    }

    public int firstQuarterEndMonth() {
        return (fiscalYearEndMonth + 2) % 12 + 1;
    }

    public int finalQuarterMonth() {
        return fiscalYearEndMonth;
    }

    /**
     * Fiscal year a period belongs to, named after the calendar year in which that fiscal year closes.
     */
    public int fiscalYear(LocalDate periodEnd) {
        YearMonth month = effectiveMonth(periodEnd);
        return month.getMonthValue() <= fiscalYearEndMonth ? month.getYear() : month.getYear() + 1;
    }

    /**
     * 1-4; the quarter closing in the fiscal year-end month is 4.
     */
    public int fiscalQuarter(LocalDate periodEnd) {
        int monthsIntoYear = Math.floorMod(effectiveMonth(periodEnd).getMonthValue() - fiscalYearEndMonth, 12);
        return monthsIntoYear == 0 ? 4 : (monthsIntoYear + 2) / 3;
    }

    public boolean isFinalQuarterMonth(LocalDate periodEnd) {
        return effectiveMonth(periodEnd).getMonthValue() == finalQuarterMonth();
    }

    @Override
    public String toString() {
        return "FiscalCalendar[yearEndMonth=" + fiscalYearEndMonth + (assumed ? ", assumed" : "") + "]";
    }
}
