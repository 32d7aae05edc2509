package com.goormthonuniv.trialguard.dto;

import java.util.List;

public record CategoryScore(
        RiskCategory category,
        double score,                 // 0~100, higher = riskier
        int findingsCount,
        List<String> keyConcerns      // at most 3
) {
    public CategoryScore {
        keyConcerns = keyConcerns == null ? List.of() : List.copyOf(keyConcerns);
    }
}
