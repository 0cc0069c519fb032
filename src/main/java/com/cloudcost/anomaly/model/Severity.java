package com.cloudcost.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    MEDIUM,
    HIGH;

    public static final double HIGH_Z_SCORE = 3.0;

    public static Severity fromZScore(double zScore) {
        return Math.abs(zScore) > HIGH_Z_SCORE ? HIGH : MEDIUM;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
