package com.ifip.fundamentals.domain;

public enum WarningCode {
    METRIC_UNAVAILABLE,
    NO_USABLE_DATA,
    NO_BASELINE,
    SCALE_MISMATCH,
    OUTSIZED_QUARTER,
    FISCAL_YEAR_END_ASSUMED,
    MALFORMED_FACTS_DROPPED,
    GROWTH_FLAGGED,
    QUARTERLY_SUM_MISMATCH,
    BALANCE_SHEET_MISMATCH,
    UPSTREAM_UNAVAILABLE
}
