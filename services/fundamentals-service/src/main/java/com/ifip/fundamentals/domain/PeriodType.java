package com.ifip.fundamentals.domain;

/**
 * Duration concepts (income and cash-flow items) accumulate over a period; instant concepts
 * (balance-sheet items) are measured at the period end.
 */
public enum PeriodType {
    DURATION,
    INSTANT
}
