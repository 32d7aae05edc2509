package com.goormthonuniv.trialguard.risk;

import com.goormthonuniv.trialguard.dto.CategoryScore;
import com.goormthonuniv.trialguard.dto.NarrativeFinding;
import com.goormthonuniv.trialguard.dto.Protocol;
import com.goormthonuniv.trialguard.dto.Protocol.DrugProfile;
import com.goormthonuniv.trialguard.dto.Protocol.PatientPopulation;
import com.goormthonuniv.trialguard.dto.Protocol.StatisticalPlan;
import com.goormthonuniv.trialguard.dto.Protocol.StudyDesign;
import com.goormthonuniv.trialguard.dto.RiskCategory;
import com.goormthonuniv.trialguard.dto.RiskLevel;
import com.goormthonuniv.trialguard.dto.RiskScore;
import com.goormthonuniv.trialguard.dto.ScoredTrial;
import com.goormthonuniv.trialguard.dto.TrialRecord;
import com.goormthonuniv.trialguard.util.ScoreMath;
import com.goormthonuniv.trialguard.util.TextUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Combines three rule-based signals into one risk score:
 * <pre>
 * overall = 0.40 * historical_precedent + 0.35 * safety_alignment + 0.25 * design_completeness
 * </pre>
 * Every category score is 0~100 where higher means riskier. Missing protocol data never fails a
 * run; it either adds its documented penalty or falls back to a neutral value.
 */
@Component
public class RiskScoringEngine {

    static final double MAX_SCORE = 100.0;
    static final double NEUTRAL_HISTORICAL_SCORE = 50.0;
    static final int MAX_CONCERNS = 3;
    static final int MIN_SAFETY_PLAN_LENGTH = 50;
    static final int MIN_EFFICACY_ENROLLMENT = 50;

    public RiskScore score(Protocol protocol, List<ScoredTrial> matchedTrials, List<NarrativeFinding> findings) {
        List<ScoredTrial> trials = matchedTrials == null ? List.of() : matchedTrials;
        List<NarrativeFinding> narrative = findings == null ? List.of() : findings;

        CategoryScore historical = historicalPrecedent(trials);
        CategoryScore safety = safetyAlignment(protocol);
        CategoryScore design = designCompleteness(protocol);

        double overall = ScoreMath.round(ScoreMath.clamp(
                historical.score() * RiskCategory.HISTORICAL_PRECEDENT.weight()
                        + safety.score() * RiskCategory.SAFETY_ALIGNMENT.weight()
                        + design.score() * RiskCategory.DESIGN_COMPLETENESS.weight(),
                0.0, MAX_SCORE), 1);

        return new RiskScore(
                overall,
                RiskLevel.fromScore(overall),
                confidence(trials.size(), narrative.size()),
                List.of(historical, safety, design));
    }

    // ===================== historical precedent =====================

    CategoryScore historicalPrecedent(List<ScoredTrial> trials) {
        if (trials.isEmpty()) {
            return new CategoryScore(RiskCategory.HISTORICAL_PRECEDENT, NEUTRAL_HISTORICAL_SCORE, 0,
                    List.of("Limited historical data available"));
        }

        List<TrialRecord> failed = trials.stream().map(ScoredTrial::trial).filter(TrialRecord::failed).toList();
        double failureRate = (double) failed.size() / trials.size();
        double avgSimilarity = trials.stream().mapToDouble(ScoredTrial::similarityScore).average().orElse(0.0);
        double adjusted = failureRate * 100.0 * avgSimilarity;

        // the strongest matching keyword family sets the multiplier; families do not compound
        double multiplier = 1.0;
        Set<String> concerns = new LinkedHashSet<>();
        for (TrialRecord trial : failed) {
            for (String reason : trial.failureReasons()) {
                for (FailureKeyword keyword : FailureKeyword.values()) {
                    if (keyword.matches(reason)) {
                        multiplier = Math.max(multiplier, keyword.multiplier());
                        concerns.add(keyword.concern());
                    }
                }
            }
        }

        double score = ScoreMath.round(ScoreMath.clamp(adjusted * multiplier, 0.0, MAX_SCORE), 1);
        List<String> keyConcerns = concerns.isEmpty()
                ? List.of(failed.size() + "/" + trials.size() + " similar trials failed")
                : concerns.stream().limit(MAX_CONCERNS).toList();
        return new CategoryScore(RiskCategory.HISTORICAL_PRECEDENT, score, failed.size(), keyConcerns);
    }

    // ===================== safety alignment =====================

    CategoryScore safetyAlignment(Protocol protocol) {
        DrugProfile drug = protocol.drugProfile();
        PatientPopulation population = protocol.patientPopulation();
        double score = 0.0;
        List<String> concerns = new ArrayList<>();

        int unmitigated = 0;
        for (String contraindication : drug.knownContraindications()) {
            if (!TextUtils.mentionedIn(contraindication, population.exclusionCriteria())) {
                unmitigated++;
                score += 20;
            }
        }
        if (unmitigated > 0) {
            concerns.add(unmitigated + " contraindications not in exclusion criteria");
        }

        String plan = protocol.safetyMonitoringPlan();
        if (plan == null || plan.length() < MIN_SAFETY_PLAN_LENGTH) {
            score += 15;
            concerns.add("Incomplete safety monitoring plan");
        }

        if (!drug.pharmacogenomicMarkers().isEmpty() && population.biomarkerRequirements().isEmpty()) {
            score += 25;
            concerns.add("Known pharmacogenomic markers not used for patient selection");
        }

        return category(RiskCategory.SAFETY_ALIGNMENT, score, concerns);
    }

    // ===================== design completeness =====================

    CategoryScore designCompleteness(Protocol protocol) {
        StudyDesign design = protocol.studyDesign();
        StatisticalPlan stats = protocol.statisticalPlan();
        boolean efficacyTrial = protocol.metadata().phase() != null && protocol.metadata().phase().isEfficacyPhase();
        double score = 0.0;
        List<String> concerns = new ArrayList<>();

        if (efficacyTrial && !design.placeboControlled()) {
            score += 30;
            concerns.add("No placebo control in efficacy trial");
        }
        if (!stats.powerCalculationProvided()) {
            score += 25;
            concerns.add("No statistical power calculation provided");
        }
        int primaryEndpoints = protocol.primaryEndpoints().size();
        if (primaryEndpoints == 0) {
            score += 20;
            concerns.add("No primary endpoint defined");
        } else if (primaryEndpoints > 1) {
            score += 10;
            concerns.add("Multiple primary endpoints may dilute power");
        }
        if (TextUtils.isBlank(protocol.safetyMonitoringPlan())) {
            score += 15;
            concerns.add("No safety monitoring plan");
        }
        if (efficacyTrial && "open-label".equals(TextUtils.normalize(design.blinding()))) {
            score += 20;
            concerns.add("Open-label design in efficacy trial");
        }
        if (efficacyTrial && stats.plannedEnrollment() < MIN_EFFICACY_ENROLLMENT) {
            score += 15;
            concerns.add("Small sample size (" + stats.plannedEnrollment() + ") for efficacy trial");
        }

        return category(RiskCategory.DESIGN_COMPLETENESS, score, concerns);
    }

    // ===================== confidence =====================

    /** Data-availability heuristic, not a statistical interval. */
    static double confidence(int matchedTrials, int findings) {
        double confidence = 0.5;
        if (matchedTrials >= 5) {
            confidence += 0.3;
        } else if (matchedTrials >= 3) {
            confidence += 0.2;
        } else if (matchedTrials >= 1) {
            confidence += 0.1;
        }
        if (findings >= 3) {
            confidence += 0.2;
        }
        return ScoreMath.round(ScoreMath.clamp(confidence, 0.0, 1.0), 2);
    }

    private static CategoryScore category(RiskCategory category, double rawScore, List<String> concerns) {
        double score = ScoreMath.round(ScoreMath.clamp(rawScore, 0.0, MAX_SCORE), 1);
        return new CategoryScore(category, score, concerns.size(),
                concerns.subList(0, Math.min(MAX_CONCERNS, concerns.size())));
    }

    /** Keyword families looked for in failed trials' failure reasons. */
    enum FailureKeyword {
        PLACEBO(1.2, "High placebo response in similar trials", "placebo"),
        BIOMARKER(1.3, "Biomarker selection issues in similar trials", "biomarker", "enrichment"),
        POWER(1.15, "Statistical power issues in similar trials", "power", "sample size");

        private final double multiplier;
        private final String concern;
        private final String[] terms;

        FailureKeyword(double multiplier, String concern, String... terms) {
            this.multiplier = multiplier;
            this.concern = concern;
            this.terms = terms;
        }

        double multiplier() {
            return multiplier;
        }

        String concern() {
            return concern;
        }

        boolean matches(String reason) {
            if (reason == null) return false;
            String r = reason.toLowerCase(Locale.ROOT);
            for (String term : terms) {
                if (r.contains(term)) return true;
            }
            return false;
        }
    }
}
