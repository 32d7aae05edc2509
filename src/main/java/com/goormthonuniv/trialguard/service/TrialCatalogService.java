package com.goormthonuniv.trialguard.service;

import com.goormthonuniv.trialguard.corpus.CorpusIndex;
import com.goormthonuniv.trialguard.corpus.CorpusRegistry;
import com.goormthonuniv.trialguard.dto.FailurePattern;
import com.goormthonuniv.trialguard.dto.TrialFilter;
import com.goormthonuniv.trialguard.dto.TrialRecord;
import com.goormthonuniv.trialguard.util.TextUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.BitSet;
import java.util.List;
import java.util.Optional;

/**
 * Browsing access to the live corpus: identifier lookup, attribute filtering and the
 * pre-computed failure patterns.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrialCatalogService {

    private final CorpusRegistry corpus;

    public Optional<TrialRecord> findById(String nctId) {
        return corpus.current().findById(nctId);
    }

    /** Matching trials in corpus order, at most {@code filter.limit()} of them. */
    public List<TrialRecord> filter(TrialFilter filter) {
        TrialFilter f = filter == null ? TrialFilter.all() : filter;
        int limit = f.limit() > 0 ? f.limit() : TrialFilter.DEFAULT_LIMIT;
        CorpusIndex index = corpus.current();

        BitSet positions = new BitSet();
        positions.set(0, index.size());

        if (!TextUtils.isBlank(f.drugClass())) {
            BitSet byDrug = new BitSet();
            for (String indexed : index.drugClasses()) {
                if (TextUtils.containsEither(f.drugClass(), indexed)) {
                    byDrug.or(index.drugClassPositions(indexed));
                }
            }
            positions.and(byDrug);
        }
        if (!TextUtils.isBlank(f.therapeuticArea())) {
            String wanted = TextUtils.normalize(f.therapeuticArea());
            BitSet byArea = new BitSet();
            for (String indexed : index.therapeuticAreas()) {
                if (indexed.contains(wanted)) {
                    byArea.or(index.therapeuticAreaPositions(indexed));
                }
            }
            positions.and(byArea);
        }
        if (f.phase() != null) {
            positions.and(index.phasePositions(f.phase()));
        }
        if (f.outcome() != null) {
            positions.and(index.outcomePositions(f.outcome()));
        }

        List<TrialRecord> matched = index.trialsAt(positions);
        log.debug("[TrialGuard] filter drugClass=\"{}\" area=\"{}\" phase={} outcome={} matched={} limit={}",
                f.drugClass(), f.therapeuticArea(), f.phase(), f.outcome(), matched.size(), limit);
        return List.copyOf(matched.subList(0, Math.min(limit, matched.size())));
    }

    /**
     * Failure statistics for the area and drug class pair ("psychiatry_ssri"), or for the area
     * alone when no drug class is given.
     */
    public Optional<FailurePattern> failurePattern(String therapeuticArea, String drugClass) {
        if (TextUtils.isBlank(therapeuticArea)) return Optional.empty();
        return corpus.current().failurePattern(patternKey(therapeuticArea, drugClass));
    }

    static String patternKey(String therapeuticArea, String drugClass) {
        String area = TextUtils.normalize(therapeuticArea);
        return TextUtils.isBlank(drugClass) ? area : area + "_" + TextUtils.normalize(drugClass);
    }
}
