package com.goormthonuniv.trialguard.dto;

public record Recommendation(
        int priority,                 // 1 = highest
        String title,
        String description,
        int expectedRiskReduction,    // 0~100 points
        String estimatedCost,
        String implementationTime,
        Difficulty difficulty,
        RiskCategory impactCategory
) {}
