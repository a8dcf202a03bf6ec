package com.ifip.fundamentals.domain;

public enum GrowthKind {
    YOY,
    QOQ
}
