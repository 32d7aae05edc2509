package com.goormthonuniv.trialguard.search;

import com.goormthonuniv.trialguard.dto.Protocol;
import com.goormthonuniv.trialguard.dto.TrialPhase;
import com.goormthonuniv.trialguard.util.TextUtils;

/**
 * Attributes to match historical trials against. Only the drug class is required; a blank
 * one is searched as "Unknown". Blank optional attributes are treated as not supplied.
 */
public record SearchQuery(
        String drugClass,
        String therapeuticArea,
        TrialPhase phase,
        String populationAge,
        int topK
) {
    public static final int DEFAULT_TOP_K = 5;

    public SearchQuery {
        drugClass = TextUtils.orUnknown(drugClass);
        therapeuticArea = TextUtils.isBlank(therapeuticArea) ? null : therapeuticArea;
        populationAge = TextUtils.isBlank(populationAge) ? null : populationAge;
    }

    public static SearchQuery of(String drugClass) {
        return new SearchQuery(drugClass, null, null, null, DEFAULT_TOP_K);
    }

    public static SearchQuery forProtocol(Protocol protocol, int topK) {
        return new SearchQuery(
                protocol.drugProfile().drugClass(),
                protocol.patientPopulation().therapeuticArea(),
                protocol.metadata().phase(),
                protocol.patientPopulation().ageRange(),
                topK);
    }

    public SearchQuery withTopK(int k) {
        return new SearchQuery(drugClass, therapeuticArea, phase, populationAge, k);
    }
}
