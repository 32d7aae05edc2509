package com.goormthonuniv.trialguard.dto;

public record ComparisonRow(
        String field,                 // "Population Age" | "Drug Class" | ...
        String current,
        String historical,
        MatchStatus matchStatus,
        RiskLevel riskLevel,
        String explanation            // only set for risk factors
) {}
