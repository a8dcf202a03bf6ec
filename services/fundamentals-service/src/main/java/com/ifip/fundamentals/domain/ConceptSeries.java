package com.ifip.fundamentals.domain;

import java.util.List;
import java.util.Optional;

/**
 * Classified history of the concept chosen for one logical metric.
 *
 * <p>{@code all} holds one entry per raw fact. The bucket lists hold the authoritative entry per
 * period end, oldest first; superseded restatements only appear in {@code all}.
 */
public record ConceptSeries(
    LogicalMetric metric,
    String concept,
    int fiscalYearEndMonth,
    List<ClassifiedFact> all,
    List<ClassifiedFact> quarterly,
    List<ClassifiedFact> annual,
    List<ClassifiedFact> ytd,
    List<ClassifiedFact> pointInTime,
    List<Warning> warnings
) {
    public ConceptSeries {
        all = List.copyOf(all);
        quarterly = List.copyOf(quarterly);
        annual = List.copyOf(annual);
        ytd = List.copyOf(ytd);
        pointInTime = List.copyOf(pointInTime);
        warnings = List.copyOf(warnings);
    }

    public List<ClassifiedFact> bucket(PeriodBucket bucket) {
        return switch (bucket) {
            case QUARTERLY -> quarterly;
            case ANNUAL -> annual;
            case YTD -> ytd;
            case POINT_IN_TIME -> pointInTime;
        };
    }

    public boolean hasUsableData() {
        return !quarterly.isEmpty() || !annual.isEmpty() || !ytd.isEmpty() || !pointInTime.isEmpty();
    }

    public boolean hasWarning(WarningCode code) {
        return warnings.stream().anyMatch(w -> w.code() == code);
    }

    public Optional<ClassifiedFact> latest(PeriodBucket bucket) {
        List<ClassifiedFact> entries = bucket(bucket);
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
    }
}
