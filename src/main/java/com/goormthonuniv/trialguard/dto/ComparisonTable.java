package com.goormthonuniv.trialguard.dto;

import java.util.List;

public record ComparisonTable(
        TrialReference historicalTrial,
        List<ComparisonRow> rows,     // always the same five fields, same order
        double overallSimilarity,     // share of EXACT_MATCH/MATCH rows
        String riskAssessment
) {
    public ComparisonTable {
        rows = List.copyOf(rows);
    }
}
