package com.goormthonuniv.trialguard.corpus;

import com.goormthonuniv.trialguard.dto.FailurePattern;
import com.goormthonuniv.trialguard.dto.TrialRecord;

import java.util.List;
import java.util.Map;

public record LoadedCorpus(
        List<TrialRecord> trials,
        Map<String, FailurePattern> failurePatterns
) {
    public LoadedCorpus {
        trials = List.copyOf(trials);
        failurePatterns = Map.copyOf(failurePatterns);
    }

    public static LoadedCorpus empty() {
        return new LoadedCorpus(List.of(), Map.of());
    }

    public CorpusIndex index() {
        return CorpusIndex.build(trials, failurePatterns);
    }
}
