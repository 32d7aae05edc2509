package com.goormthonuniv.trialguard.search;

import com.goormthonuniv.trialguard.dto.TrialPhase;
import com.goormthonuniv.trialguard.dto.TrialRecord;
import com.goormthonuniv.trialguard.util.ScoreMath;
import com.goormthonuniv.trialguard.util.TextUtils;
import com.goormthonuniv.trialguard.util.TextUtils.IntRange;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Weighted partial-credit similarity between a query and one trial.
 *
 * <p>Only attributes the caller supplied contribute a weight; the sum is normalized by the
 * weights that applied, so leaving out the phase does not count as a phase mismatch.</p>
 */
@Component
public class SimilarityScorer {

    static final double DRUG_CLASS_WEIGHT = 0.40;
    static final double THERAPEUTIC_AREA_WEIGHT = 0.30;
    static final double PHASE_WEIGHT = 0.20;
    static final double POPULATION_AGE_WEIGHT = 0.10;

    public double similarity(TrialRecord trial, SearchQuery query) {
        double score = 0.0;
        double applicable = 0.0;

        // drug class is always part of the query
        applicable += DRUG_CLASS_WEIGHT;
        score += textCredit(query.drugClass(), trial.drugClass()) * DRUG_CLASS_WEIGHT;

        if (query.therapeuticArea() != null) {
            applicable += THERAPEUTIC_AREA_WEIGHT;
            score += textCredit(query.therapeuticArea(), trial.therapeuticArea()) * THERAPEUTIC_AREA_WEIGHT;
        }

        if (query.phase() != null) {
            applicable += PHASE_WEIGHT;
            score += phaseCredit(query.phase(), trial.phase()) * PHASE_WEIGHT;
        }

        if (query.populationAge() != null) {
            applicable += POPULATION_AGE_WEIGHT;
            if (ageRangesOverlap(query.populationAge(), trial.populationAge())) {
                score += POPULATION_AGE_WEIGHT;
            }
        }

        if (applicable == 0.0) return 0.0;
        return ScoreMath.clamp(score / applicable, 0.0, 1.0);
    }

    /** 1 on equality, 0.5 when one contains the other, else 0. */
    static double textCredit(String query, String value) {
        String q = TextUtils.normalize(query);
        String v = TextUtils.normalize(value);
        if (q.equals(v)) return 1.0;
        if (q.contains(v) || v.contains(q)) return 0.5;
        return 0.0;
    }

    static double phaseCredit(TrialPhase query, TrialPhase value) {
        if (value == null) return 0.0;
        if (query == value) return 1.0;
        return query.isAdjacentTo(value) ? 0.5 : 0.0;
    }

    static boolean ageRangesOverlap(String a, String b) {
        Optional<IntRange> r1 = TextUtils.parseRange(a);
        Optional<IntRange> r2 = TextUtils.parseRange(b);
        return r1.isPresent() && r2.isPresent() && r1.get().overlaps(r2.get());
    }
}
