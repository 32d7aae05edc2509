package com.goormthonuniv.trialguard.dto;

public record ScoredTrial(
        TrialRecord trial,
        double similarityScore        // 0.0~1.0 weighted attribute similarity to the query
) {}
