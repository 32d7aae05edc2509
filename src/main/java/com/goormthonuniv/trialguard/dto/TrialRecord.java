package com.goormthonuniv.trialguard.dto;

import java.util.List;

/**
 * One historical trial of the corpus. Immutable once loaded.
 */
public record TrialRecord(
        String nctId,                 // "NCT02134613"
        String trialName,
        TrialPhase phase,             // null when not reported
        String drugClass,             // free text, compared case-insensitively
        String therapeuticArea,       // free text, compared case-insensitively
        TrialOutcome outcome,
        String populationAge,         // e.g. "18-65"
        Integer plannedEnrollment,
        Integer actualEnrollment,
        boolean placeboRunIn,
        String studyDesign,
        List<String> tags,
        List<String> keyLearnings,
        List<String> failureReasons   // only populated for failed/terminated trials
) {
    public TrialRecord {
        outcome = outcome == null ? TrialOutcome.UNKNOWN : outcome;
        tags = tags == null ? List.of() : List.copyOf(tags);
        keyLearnings = keyLearnings == null ? List.of() : List.copyOf(keyLearnings);
        failureReasons = failureReasons == null ? List.of() : List.copyOf(failureReasons);
    }

    public boolean failed() {
        return outcome == TrialOutcome.FAILED;
    }
}
