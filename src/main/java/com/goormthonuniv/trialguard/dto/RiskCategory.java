package com.goormthonuniv.trialguard.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Risk categories and their fixed weight in the overall score. The weights sum to 1.0.
 */
public enum RiskCategory {
    HISTORICAL_PRECEDENT("historical_precedent", 0.40),
    SAFETY_ALIGNMENT("safety_alignment", 0.35),
    DESIGN_COMPLETENESS("design_completeness", 0.25);

    private final String value;
    private final double weight;

    RiskCategory(String value, double weight) {
        this.value = value;
        this.weight = weight;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public double weight() {
        return weight;
    }

    public static Optional<RiskCategory> parse(String raw) {
        if (raw == null) return Optional.empty();
        String s = raw.strip().toLowerCase(Locale.ROOT);
        for (RiskCategory c : values()) {
            if (c.value.equals(s)) return Optional.of(c);
        }
        return Optional.empty();
    }
}
