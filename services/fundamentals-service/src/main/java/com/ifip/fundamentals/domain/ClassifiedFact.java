package com.ifip.fundamentals.domain;

import java.time.LocalDate;

public record ClassifiedFact(
    RawFact fact,
    PeriodBucket bucket,
    double confidence,
    String reason
) {

    public LocalDate periodEnd() {
        return fact.periodEnd();
    }

    public double value() {
        return fact.value();
    }

    public ClassifiedFact withReason(String newReason) {
        return new ClassifiedFact(fact, bucket, confidence, newReason);
    }
}
