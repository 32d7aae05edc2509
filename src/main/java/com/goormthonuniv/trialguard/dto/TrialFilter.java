package com.goormthonuniv.trialguard.dto;

/**
 * Attribute filter for browsing the corpus. Every field is optional; a null outcome means all outcomes.
 */
public record TrialFilter(
        String drugClass,
        String therapeuticArea,
        TrialPhase phase,
        TrialOutcome outcome,
        int limit
) {
    public static final int DEFAULT_LIMIT = 20;

    public static TrialFilter all() {
        return new TrialFilter(null, null, null, null, DEFAULT_LIMIT);
    }
}
