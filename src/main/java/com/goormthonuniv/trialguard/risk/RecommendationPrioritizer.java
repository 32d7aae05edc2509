package com.goormthonuniv.trialguard.risk;

import com.goormthonuniv.trialguard.dto.Difficulty;
import com.goormthonuniv.trialguard.dto.NarrativeFinding;
import com.goormthonuniv.trialguard.dto.Recommendation;
import com.goormthonuniv.trialguard.dto.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns narrative findings into an ordered action list.
 * priority = riskReduction^2 * feasibility / 10000, highest first.
 */
@Component
public class RecommendationPrioritizer {

    public List<Recommendation> prioritize(List<NarrativeFinding> findings) {
        if (findings == null || findings.isEmpty()) return List.of();

        List<Ranked> ranked = new ArrayList<>(findings.size());
        for (NarrativeFinding f : findings) {
            if (f == null) continue;
            ranked.add(new Ranked(f, severityOf(f), difficultyOf(f)));
        }
        // stable: equal priorities keep input order
        ranked.sort(Comparator.comparingDouble(Ranked::priorityScore).reversed());

        List<Recommendation> out = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            Ranked r = ranked.get(i);
            NarrativeFinding f = r.finding();
            out.add(new Recommendation(
                    i + 1,
                    f.title(),
                    f.recommendation(),
                    r.severity().riskReduction(),
                    f.estimatedCostToFix(),
                    r.difficulty().implementationTime(),
                    r.difficulty(),
                    f.category()));
        }
        return out;
    }

    static double priorityScore(Severity severity, Difficulty difficulty) {
        double reduction = severity.riskReduction();
        return reduction * reduction * difficulty.feasibility() / 10000.0;
    }

    private static Severity severityOf(NarrativeFinding f) {
        return f.severity() == null ? Severity.MEDIUM : f.severity();
    }

    private static Difficulty difficultyOf(NarrativeFinding f) {
        return f.implementationDifficulty() == null ? Difficulty.MEDIUM : f.implementationDifficulty();
    }

    private record Ranked(NarrativeFinding finding, Severity severity, Difficulty difficulty) {
        double priorityScore() {
            return RecommendationPrioritizer.priorityScore(severity, difficulty);
        }
    }
}
