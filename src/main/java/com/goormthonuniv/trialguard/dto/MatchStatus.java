package com.goormthonuniv.trialguard.dto;

public enum MatchStatus {
    EXACT_MATCH,
    MATCH,
    MISMATCH,
    RISK_FACTOR;

    public boolean similar() {
        return this == EXACT_MATCH || this == MATCH;
    }
}
