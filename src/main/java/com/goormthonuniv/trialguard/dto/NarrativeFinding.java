package com.goormthonuniv.trialguard.dto;

import java.util.List;

/**
 * A risk finding produced upstream by the narrative analysis collaborator.
 * The engine only counts and ranks these, it never generates them.
 */
public record NarrativeFinding(
        String title,
        RiskCategory category,
        Severity severity,
        String description,
        List<String> evidence,
        List<String> historicalTrialReferences,
        String quantifiedImpact,          // e.g. "Increases failure risk by 35%"
        String recommendation,
        String estimatedCostToFix,
        Difficulty implementationDifficulty  // null when the collaborator gave none
) {
    public NarrativeFinding {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        historicalTrialReferences = historicalTrialReferences == null ? List.of() : List.copyOf(historicalTrialReferences);
    }
}
