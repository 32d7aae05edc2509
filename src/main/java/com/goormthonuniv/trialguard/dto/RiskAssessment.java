package com.goormthonuniv.trialguard.dto;

import java.util.List;

public record RiskAssessment(
        RiskScore riskScore,
        List<ScoredTrial> similarTrials,
        List<ComparisonTable> comparisons,    // one per leading similar trial
        List<Recommendation> recommendations,
        List<NarrativeFinding> findings,
        FailurePattern failurePattern         // null when the corpus has none for the area
) {
    public RiskAssessment {
        similarTrials = List.copyOf(similarTrials);
        comparisons = List.copyOf(comparisons);
        recommendations = List.copyOf(recommendations);
        findings = List.copyOf(findings);
    }
}
