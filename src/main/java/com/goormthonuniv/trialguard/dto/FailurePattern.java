package com.goormthonuniv.trialguard.dto;

import java.util.List;

/**
 * Pre-computed failure statistics for a therapeutic area, or an area and drug class pair.
 */
public record FailurePattern(
        String key,                   // "psychiatry" or "psychiatry_ssri"
        Double failureRate,           // 0~1, null when not computed
        List<String> commonReasons,
        List<String> mitigations
) {
    public FailurePattern {
        commonReasons = commonReasons == null ? List.of() : List.copyOf(commonReasons);
        mitigations = mitigations == null ? List.of() : List.copyOf(mitigations);
    }
}
