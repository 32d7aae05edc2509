package com.goormthonuniv.trialguard.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Clinical trial phases in their fixed progression order.
 * The declaration order is significant: adjacency for partial-credit matching is
 * the ordinal distance.
 */
public enum TrialPhase {
    PHASE_1("Phase 1"),
    PHASE_1_2("Phase 1/2"),
    PHASE_2("Phase 2"),
    PHASE_2_3("Phase 2/3"),
    PHASE_3("Phase 3"),
    PHASE_4("Phase 4");

    private final String label;

    TrialPhase(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Phases 2 and 3 (including 2/3) test efficacy rather than safety or dosing. */
    public boolean isEfficacyPhase() {
        String l = label.toLowerCase(Locale.ROOT);
        return l.contains("phase 2") || l.contains("phase 3");
    }

    public boolean isAdjacentTo(TrialPhase other) {
        return other != null && Math.abs(ordinal() - other.ordinal()) <= 1;
    }

    public static Optional<TrialPhase> fromLabel(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String s = raw.strip();
        for (TrialPhase p : values()) {
            if (p.label.equalsIgnoreCase(s)) return Optional.of(p);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return label;
    }
}
