package com.goormthonuniv.trialguard.dto;

import java.util.List;

/**
 * Terminal output of one scoring run.
 *
 * <p>{@code confidence} is a data-availability heuristic (how many similar trials and
 * narrative findings backed the score), not a statistical confidence interval.</p>
 */
public record RiskScore(
        double overallScore,          // 0~100
        RiskLevel riskLevel,
        double confidence,            // 0~1
        List<CategoryScore> categoryScores
) {
    public RiskScore {
        categoryScores = List.copyOf(categoryScores);
        if (categoryScores.size() != RiskCategory.values().length) {
            throw new IllegalArgumentException("expected one score per risk category, got " + categoryScores.size());
        }
    }

    public CategoryScore category(RiskCategory category) {
        return categoryScores.stream()
                .filter(c -> c.category() == category)
                .findFirst()
                .orElseThrow();
    }
}
