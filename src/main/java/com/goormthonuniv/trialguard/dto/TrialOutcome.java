package com.goormthonuniv.trialguard.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TrialOutcome {
    SUCCESS("success"),
    FAILED("failed"),
    TERMINATED("terminated"),
    UNKNOWN("unknown");   // ongoing or not reported

    private final String value;

    TrialOutcome(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Never fails: anything that is not a known terminal outcome is UNKNOWN. */
    public static TrialOutcome parse(String raw) {
        if (raw == null) return UNKNOWN;
        String s = raw.strip().toLowerCase(Locale.ROOT);
        for (TrialOutcome o : values()) {
            if (o.value.equals(s)) return o;
        }
        return UNKNOWN;
    }
}
