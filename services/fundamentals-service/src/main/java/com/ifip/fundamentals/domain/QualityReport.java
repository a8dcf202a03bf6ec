package com.ifip.fundamentals.domain;

public record QualityReport(
    String ticker,
    String companyName,
    double completenessScore,
    double freshnessScore,
    double dataQualityScore,
    double penalty,
    double overallScore,
    Grade grade
) {
}
