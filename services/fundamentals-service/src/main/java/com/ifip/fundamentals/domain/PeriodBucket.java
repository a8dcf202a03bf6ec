package com.ifip.fundamentals.domain;

public enum PeriodBucket {
    QUARTERLY,
    ANNUAL,
    YTD,
    POINT_IN_TIME
}
