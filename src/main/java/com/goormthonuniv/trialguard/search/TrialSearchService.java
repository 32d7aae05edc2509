package com.goormthonuniv.trialguard.search;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.goormthonuniv.trialguard.corpus.CorpusIndex;
import com.goormthonuniv.trialguard.corpus.CorpusRegistry;
import com.goormthonuniv.trialguard.dto.ScoredTrial;
import com.goormthonuniv.trialguard.dto.TrialPhase;
import com.goormthonuniv.trialguard.dto.TrialRecord;
import com.goormthonuniv.trialguard.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;

/**
 * Multi-stage similarity search over the live corpus index.
 * <ol>
 *   <li>candidate generation from the drug class postings (exact, then substring either way),
 *       narrowed by therapeutic area unless that leaves fewer than K</li>
 *   <li>weighted similarity per candidate</li>
 *   <li>stable sort by similarity, first K</li>
 * </ol>
 * Always returns a list; an empty corpus or a non-positive K gives an empty one.
 */
@Slf4j
@Service
public class TrialSearchService {

    // ===== dependencies =====
    private final CorpusRegistry corpus;
    private final SimilarityScorer scorer;
    private final int defaultTopK;

    // ===== cache =====
    // keyed by index generation, so results from a replaced corpus are never served
    private final Cache<SearchKey, List<ScoredTrial>> searchCache;

    public TrialSearchService(CorpusRegistry corpus,
                              SimilarityScorer scorer,
                              @Value("${trialguard.search.default-top-k:5}") int defaultTopK,
                              @Value("${trialguard.search.cache.maximum-size:2000}") long cacheSize,
                              @Value("${trialguard.search.cache.expire-after-write-minutes:15}") long cacheMinutes) {
        this.corpus = corpus;
        this.scorer = scorer;
        this.defaultTopK = defaultTopK;
        this.searchCache = Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofMinutes(cacheMinutes))
                .maximumSize(cacheSize)
                .build();
    }

    public List<ScoredTrial> search(String drugClass, String therapeuticArea, TrialPhase phase, String populationAge) {
        return search(new SearchQuery(drugClass, therapeuticArea, phase, populationAge, defaultTopK));
    }

    public List<ScoredTrial> search(String drugClass, String therapeuticArea, TrialPhase phase, String populationAge, int topK) {
        return search(new SearchQuery(drugClass, therapeuticArea, phase, populationAge, topK));
    }

    public List<ScoredTrial> search(SearchQuery query) {
        if (query.topK() <= 0) return List.of();
        CorpusIndex index = corpus.current();
        if (index.isEmpty()) return List.of();
        return searchCache.get(new SearchKey(index.generation(), query), k -> rank(index, query));
    }

    public int defaultTopK() {
        return defaultTopK;
    }

    // ===================== stages =====================

    List<ScoredTrial> rank(CorpusIndex index, SearchQuery query) {
        // 1) candidate generation
        BitSet candidates = candidates(index, query);

        // 2) scoring, in corpus order
        List<ScoredTrial> scored = new ArrayList<>(candidates.cardinality());
        for (TrialRecord t : index.trialsAt(candidates)) {
            scored.add(new ScoredTrial(t, scorer.similarity(t, query)));
        }

        // 3) selection; List.sort is stable, so ties keep corpus order
        scored.sort(Comparator.comparingDouble(ScoredTrial::similarityScore).reversed());
        List<ScoredTrial> top = List.copyOf(scored.subList(0, Math.min(query.topK(), scored.size())));

        log.debug("[TrialGuard] search drugClass=\"{}\" area=\"{}\" phase={} candidates={} returned={}",
                query.drugClass(), query.therapeuticArea(), query.phase(), scored.size(), top.size());
        return top;
    }

    static BitSet candidates(CorpusIndex index, SearchQuery query) {
        String drugClass = TextUtils.normalize(query.drugClass());

        BitSet byDrugClass = index.drugClassPositions(drugClass);
        for (String indexed : index.drugClasses()) {
            if (TextUtils.containsEither(drugClass, indexed)) {
                byDrugClass.or(index.drugClassPositions(indexed));
            }
        }

        if (query.therapeuticArea() == null) return byDrugClass;

        BitSet narrowed = (BitSet) byDrugClass.clone();
        narrowed.and(index.therapeuticAreaPositions(query.therapeuticArea()));
        if (narrowed.cardinality() < query.topK()) {
            // area filter too strict: keep every drug-class candidate, scoring still favours the area
            log.debug("[TrialGuard] area \"{}\" leaves {} candidates (< {}), using drug class candidates",
                    query.therapeuticArea(), narrowed.cardinality(), query.topK());
            return byDrugClass;
        }
        return narrowed;
    }

    private record SearchKey(long generation, SearchQuery query) {}
}
