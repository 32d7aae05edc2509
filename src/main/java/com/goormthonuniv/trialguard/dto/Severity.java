package com.goormthonuniv.trialguard.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/** Severity of a narrative finding, with the risk reduction expected from addressing it. */
public enum Severity {
    LOW("low", 5),
    MEDIUM("medium", 10),
    HIGH("high", 18),
    CRITICAL("critical", 25);

    private final String value;
    private final int riskReduction;

    Severity(String value, int riskReduction) {
        this.value = value;
        this.riskReduction = riskReduction;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public int riskReduction() {
        return riskReduction;
    }

    public static Optional<Severity> parse(String raw) {
        if (raw == null) return Optional.empty();
        String s = raw.strip().toLowerCase(Locale.ROOT);
        for (Severity v : values()) {
            if (v.value.equals(s)) return Optional.of(v);
        }
        return Optional.empty();
    }
}
