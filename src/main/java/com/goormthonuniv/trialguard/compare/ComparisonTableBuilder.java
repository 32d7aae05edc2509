package com.goormthonuniv.trialguard.compare;

import com.goormthonuniv.trialguard.dto.ComparisonRow;
import com.goormthonuniv.trialguard.dto.ComparisonTable;
import com.goormthonuniv.trialguard.dto.MatchStatus;
import com.goormthonuniv.trialguard.dto.Protocol;
import com.goormthonuniv.trialguard.dto.RiskLevel;
import com.goormthonuniv.trialguard.dto.TrialRecord;
import com.goormthonuniv.trialguard.dto.TrialReference;
import com.goormthonuniv.trialguard.util.TextUtils;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Side-by-side comparison of the candidate protocol with one historical trial.
 * Always five rows, always in the same order.
 */
@Component
public class ComparisonTableBuilder {

    public static final String POPULATION_AGE = "Population Age";
    public static final String DRUG_CLASS = "Drug Class";
    public static final String STUDY_DESIGN = "Study Design";
    public static final String PLACEBO_RUN_IN = "Placebo Run-in";
    public static final String SAMPLE_SIZE = "Sample Size";

    static final int SAMPLE_SIZE_TOLERANCE = 50;
    static final double HIGH_SIMILARITY = 0.7;

    public ComparisonTable compare(Protocol protocol, TrialRecord trial) {
        List<ComparisonRow> rows = List.of(
                textRow(POPULATION_AGE,
                        TextUtils.orUnknown(protocol.patientPopulation().ageRange()),
                        TextUtils.orUnknown(trial.populationAge())),
                textRow(DRUG_CLASS,
                        TextUtils.orUnknown(protocol.drugProfile().drugClass()),
                        TextUtils.orUnknown(trial.drugClass())),
                textRow(STUDY_DESIGN,
                        TextUtils.orUnknown(protocol.studyDesign().designType()),
                        TextUtils.orUnknown(trial.studyDesign())),
                placeboRunInRow(protocol.studyDesign().placeboRunIn(), trial),
                sampleSizeRow(protocol.statisticalPlan().plannedEnrollment(),
                        trial.plannedEnrollment() == null ? 0 : trial.plannedEnrollment())
        );

        long similar = rows.stream().filter(r -> r.matchStatus().similar()).count();
        double overallSimilarity = (double) similar / rows.size();

        return new ComparisonTable(reference(trial), rows, overallSimilarity, riskAssessment(rows, overallSimilarity));
    }

    // ===================== rows =====================

    static ComparisonRow textRow(String field, String current, String historical) {
        MatchStatus status = textStatus(current, historical);
        return new ComparisonRow(field, current, historical, status,
                status == MatchStatus.MATCH ? RiskLevel.MEDIUM : RiskLevel.LOW, null);
    }

    /** Sharing the absence of a run-in with a trial that failed is itself a risk. */
    static ComparisonRow placeboRunInRow(boolean currentRunIn, TrialRecord trial) {
        String current = currentRunIn ? "Yes" : "No";
        String historical = trial.placeboRunIn() ? "Yes" : "No";
        if (!currentRunIn && !trial.placeboRunIn() && trial.failed()) {
            return new ComparisonRow(PLACEBO_RUN_IN, current, historical,
                    MatchStatus.RISK_FACTOR, RiskLevel.HIGH, "Trial failed without placebo run-in");
        }
        return textRow(PLACEBO_RUN_IN, current, historical);
    }

    static ComparisonRow sampleSizeRow(int current, int historical) {
        MatchStatus status = Math.abs((long) current - historical) < SAMPLE_SIZE_TOLERANCE
                ? MatchStatus.MATCH : MatchStatus.MISMATCH;
        RiskLevel risk = current < historical ? RiskLevel.MEDIUM : RiskLevel.LOW;
        return new ComparisonRow(SAMPLE_SIZE, String.valueOf(current), String.valueOf(historical), status, risk, null);
    }

    static MatchStatus textStatus(String current, String historical) {
        String a = TextUtils.normalize(current);
        String b = TextUtils.normalize(historical);
        if (a.equals(b)) return MatchStatus.EXACT_MATCH;
        if (a.contains(b) || b.contains(a)) return MatchStatus.MATCH;
        return MatchStatus.MISMATCH;
    }

    // ===================== summary =====================

    static String riskAssessment(List<ComparisonRow> rows, double overallSimilarity) {
        long riskFactors = rows.stream().filter(r -> r.matchStatus() == MatchStatus.RISK_FACTOR).count();
        if (riskFactors > 0) {
            return "High similarity to failed trial (" + riskFactors + " risk factors)";
        }
        if (overallSimilarity > HIGH_SIMILARITY) {
            return "High similarity to historical trial";
        }
        return "Moderate similarity";
    }

    private static TrialReference reference(TrialRecord trial) {
        return new TrialReference(
                TextUtils.orUnknown(trial.nctId()),
                TextUtils.orUnknown(trial.trialName()),
                trial.outcome().value(),
                trial.phase() == null ? "Unknown" : trial.phase().label());
    }
}
