package com.ifip.fundamentals.domain;

import java.time.LocalDate;

public record DerivedRatio(String name, double value, String unit, LocalDate period) {
}
