package com.goormthonuniv.trialguard.boundary;

import com.fasterxml.jackson.databind.JsonNode;
import com.goormthonuniv.trialguard.dto.Difficulty;
import com.goormthonuniv.trialguard.dto.NarrativeFinding;
import com.goormthonuniv.trialguard.dto.RiskCategory;
import com.goormthonuniv.trialguard.dto.Severity;
import com.goormthonuniv.trialguard.exception.InvalidInputException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads narrative findings handed over by the analysis collaborator.
 * Its output is not under our control, so a malformed entry is dropped (and logged)
 * instead of failing the whole analysis.
 */
@Slf4j
@Component
public class FindingReader {

    private static final String SUBJECT = "finding";

    /** Accepts either a findings array or an analysis object carrying a {@code findings} array. */
    public List<NarrativeFinding> readAll(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return List.of();
        JsonNode array = node.isObject() ? node.path("findings") : node;
        if (array.isMissingNode() || array.isNull()) return List.of();
        if (!array.isArray()) {
            log.warn("[TrialGuard] findings ignored: expected an array but was {}", array.getNodeType());
            return List.of();
        }
        List<NarrativeFinding> out = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            try {
                out.add(read(array.get(i)));
            } catch (InvalidInputException e) {
                log.warn("[TrialGuard] skipping malformed finding #{}: {}", i, e.getMessage());
            }
        }
        return out;
    }

    public NarrativeFinding read(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new InvalidInputException(SUBJECT, List.of("expected a JSON object"));
        }
        JsonFieldReader r = JsonFieldReader.root(node);

        RiskCategory category = r.enumValue("category", RiskCategory::parse);
        Severity severity = r.enumValue("severity", Severity::parse);
        Difficulty difficulty = r.enumValue("implementation_difficulty", Difficulty::parse);

        NarrativeFinding finding = new NarrativeFinding(
                orDefault(r.text("title"), "Finding"),
                category == null ? RiskCategory.DESIGN_COMPLETENESS : category,
                severity == null ? Severity.MEDIUM : severity,
                orDefault(r.text("description"), ""),
                r.textList("evidence"),
                r.textList("historical_trial_references"),
                r.text("quantified_impact"),
                orDefault(r.text("recommendation"), "Review and address"),
                r.text("estimated_cost_to_fix"),
                difficulty);
        r.throwIfInvalid(SUBJECT);
        return finding;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
