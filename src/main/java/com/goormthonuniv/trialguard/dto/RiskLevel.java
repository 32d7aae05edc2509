package com.goormthonuniv.trialguard.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskLevel {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    static final double MEDIUM_THRESHOLD = 30.0;
    static final double HIGH_THRESHOLD = 60.0;

    private final String value;

    RiskLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Boundaries belong to the higher band: 30.0 is medium, 60.0 is high. */
    public static RiskLevel fromScore(double overallScore) {
        if (overallScore < MEDIUM_THRESHOLD) return LOW;
        if (overallScore < HIGH_THRESHOLD) return MEDIUM;
        return HIGH;
    }
}
