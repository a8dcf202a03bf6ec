package com.ifip.fundamentals.domain;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Set;

/**
 * A single reported XBRL value exactly as the provider returned it.
 *
 * <p>{@code fiscalYear} and {@code fiscalPeriod} describe the filing that carried the value,
 * not necessarily the period the value covers: a 10-Q repeats last year's comparatives under
 * the current filing's fiscal year.
 */
public record RawFact(
    String concept,
    String unit,
    double value,
    LocalDate periodStart,
    LocalDate periodEnd,
    LocalDate filedDate,
    String formType,
    Integer fiscalYear,
    String fiscalPeriod,
    String accessionNo
) {

    private static final Set<String> ANNUAL_FORMS = Set.of("10-K", "10-K/A", "10-KT", "10-KT/A", "20-F", "20-F/A", "40-F", "40-F/A");
    private static final Set<String> QUARTERLY_FORMS = Set.of("10-Q", "10-Q/A", "10-QT", "10-QT/A");

    public boolean hasDuration() {
        return periodStart != null;
    }

    /**
     * Length of the reported period in days, or -1 for instants and facts whose start was not reported.
     */
    public long durationDays() {
        return periodStart == null ? -1 : ChronoUnit.DAYS.between(periodStart, periodEnd);
    }

    public boolean isAnnualForm() {
        return ANNUAL_FORMS.contains(normalizedForm());
    }

    public boolean isQuarterlyForm() {
        return QUARTERLY_FORMS.contains(normalizedForm());
    }

    private String normalizedForm() {
        return formType == null ? "" : formType.trim().toUpperCase(Locale.ROOT);
    }
}
