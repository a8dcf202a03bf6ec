package com.ifip.fundamentals.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Grade {
    A_PLUS("A+", 95),
    A("A", 90),
    B_PLUS("B+", 85),
    B("B", 80),
    C_PLUS("C+", 75),
    C("C", 70),
    D("D", 60),
    F("F", 0);

    private final String label;
    private final double minimumScore;

    Grade(String label, double minimumScore) {
        this.label = label;
        this.minimumScore = minimumScore;
    }

    public static Grade forScore(double score) {
        for (Grade grade : values()) {
            if (score >= grade.minimumScore) {
                return grade;
            }
        }
        return F;
    }

    public boolean isAtLeast(Grade other) {
        return ordinal() <= other.ordinal();
    }

    @JsonValue
    public String label() {
        return label;
    }

    public double minimumScore() {
        return minimumScore;
    }
}
