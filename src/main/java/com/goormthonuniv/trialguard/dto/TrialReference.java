package com.goormthonuniv.trialguard.dto;

public record TrialReference(
        String nctId,
        String trialName,
        String outcome,
        String phase
) {}
