package com.goormthonuniv.trialguard.service;

import com.goormthonuniv.trialguard.compare.ComparisonTableBuilder;
import com.goormthonuniv.trialguard.dto.ComparisonTable;
import com.goormthonuniv.trialguard.dto.FailurePattern;
import com.goormthonuniv.trialguard.dto.NarrativeFinding;
import com.goormthonuniv.trialguard.dto.Protocol;
import com.goormthonuniv.trialguard.dto.Recommendation;
import com.goormthonuniv.trialguard.dto.RiskAssessment;
import com.goormthonuniv.trialguard.dto.RiskScore;
import com.goormthonuniv.trialguard.dto.ScoredTrial;
import com.goormthonuniv.trialguard.risk.RecommendationPrioritizer;
import com.goormthonuniv.trialguard.risk.RiskScoringEngine;
import com.goormthonuniv.trialguard.search.SearchQuery;
import com.goormthonuniv.trialguard.search.TrialSearchService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/** One analysis request, end to end: search, score, compare, prioritize. */
@Slf4j
@Service
public class RiskAssessmentService {

    // ===== dependencies =====
    private final TrialSearchService searchService;
    private final RiskScoringEngine scoringEngine;
    private final ComparisonTableBuilder tableBuilder;
    private final RecommendationPrioritizer prioritizer;
    private final TrialCatalogService catalog;
    private final int comparisonCount;

    public RiskAssessmentService(TrialSearchService searchService,
                                 RiskScoringEngine scoringEngine,
                                 ComparisonTableBuilder tableBuilder,
                                 RecommendationPrioritizer prioritizer,
                                 TrialCatalogService catalog,
                                 @Value("${trialguard.assessment.comparison-count:3}") int comparisonCount) {
        this.searchService = searchService;
        this.scoringEngine = scoringEngine;
        this.tableBuilder = tableBuilder;
        this.prioritizer = prioritizer;
        this.catalog = catalog;
        this.comparisonCount = comparisonCount;
    }

    public RiskAssessment assess(Protocol protocol, List<NarrativeFinding> findings) {
        Objects.requireNonNull(protocol, "protocol");
        List<NarrativeFinding> narrative = findings == null ? List.of() : findings;

        // 1) historical matches
        List<ScoredTrial> similar = searchService.search(SearchQuery.forProtocol(protocol, searchService.defaultTopK()));

        // 2) score
        RiskScore score = scoringEngine.score(protocol, similar, narrative);

        // 3) side-by-side tables for the leading matches
        List<ComparisonTable> tables = similar.stream()
                .limit(Math.max(0, comparisonCount))
                .map(s -> tableBuilder.compare(protocol, s.trial()))
                .toList();

        // 4) recommendations
        List<Recommendation> recommendations = prioritizer.prioritize(narrative);

        // 5) area failure statistics
        FailurePattern pattern = failurePattern(protocol);

        log.info("[TrialGuard] assessed trial=\"{}\" score={} level={} confidence={} matches={} findings={}",
                protocol.metadata().trialName(), score.overallScore(), score.riskLevel(), score.confidence(),
                similar.size(), narrative.size());

        return new RiskAssessment(score, similar, tables, recommendations, narrative, pattern);
    }

    private FailurePattern failurePattern(Protocol protocol) {
        String area = protocol.patientPopulation().therapeuticArea();
        String drugClass = protocol.drugProfile().drugClass();
        return catalog.failurePattern(area, drugClass)
                .or(() -> catalog.failurePattern(area, null))
                .orElse(null);
    }
}
