package com.ifip.fundamentals.domain;

/**
 * A data-quality finding attached to a report. {@code metric} is null for company-wide findings.
 */
public record Warning(WarningCode code, LogicalMetric metric, String message) {

    public static Warning of(WarningCode code, String message) {
        return new Warning(code, null, message);
    }

    public static Warning of(WarningCode code, LogicalMetric metric, String message) {
        return new Warning(code, metric, message);
    }
}
