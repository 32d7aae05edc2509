package com.goormthonuniv.trialguard.boundary;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.trialguard.dto.Protocol;
import com.goormthonuniv.trialguard.dto.Protocol.DrugProfile;
import com.goormthonuniv.trialguard.dto.Protocol.Endpoint;
import com.goormthonuniv.trialguard.dto.Protocol.PatientPopulation;
import com.goormthonuniv.trialguard.dto.Protocol.ProtocolMetadata;
import com.goormthonuniv.trialguard.dto.Protocol.StatisticalPlan;
import com.goormthonuniv.trialguard.dto.Protocol.StudyDesign;
import com.goormthonuniv.trialguard.dto.TrialPhase;
import com.goormthonuniv.trialguard.exception.InvalidInputException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Maps a snake_case protocol document onto {@link Protocol}.
 *
 * <p>Absent fields get their defaults (empty lists, {@code false}, 0, alpha 0.05). A few
 * flat top-level keys ({@code drug_class}, {@code therapeutic_area}, {@code phase}) are accepted
 * as fallbacks for their nested counterparts. Wrong JSON types, unknown phases and violated
 * constraints are reported together in one {@link InvalidInputException}.</p>
 */
@Component
@RequiredArgsConstructor
public class ProtocolReader {

    private static final String SUBJECT = "protocol";

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public Protocol read(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException(SUBJECT, List.of("not valid JSON: " + e.getOriginalMessage()));
        }
        return read(root);
    }

    public Protocol read(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new InvalidInputException(SUBJECT, List.of("expected a JSON object"));
        }
        JsonFieldReader r = JsonFieldReader.root(root);

        Protocol protocol = new Protocol(
                metadata(r),
                drugProfile(r),
                population(r),
                studyDesign(r.child("study_design")),
                statisticalPlan(r.child("statistical_plan")),
                r.text("safety_monitoring_plan"),
                endpoints(r, "primary_endpoints"),
                endpoints(r, "secondary_endpoints")
        );
        r.throwIfInvalid(SUBJECT);

        Set<ConstraintViolation<Protocol>> violations = validator.validate(protocol);
        if (!violations.isEmpty()) {
            throw new InvalidInputException(SUBJECT, violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .toList());
        }
        return protocol;
    }

    // ===================== sections =====================

    private static ProtocolMetadata metadata(JsonFieldReader root) {
        JsonFieldReader m = root.child("metadata");
        TrialPhase phase = m.has("phase")
                ? m.enumValue("phase", TrialPhase::fromLabel)
                : root.enumValue("phase", TrialPhase::fromLabel);
        return new ProtocolMetadata(
                m.text("nct_id"),
                m.text("trial_name"),
                m.text("sponsor"),
                phase,
                m.integer("year"));
    }

    private static DrugProfile drugProfile(JsonFieldReader root) {
        JsonFieldReader d = root.child("drug_profile");
        String drugClass = d.has("drug_class") ? d.text("drug_class") : root.text("drug_class");
        return new DrugProfile(
                d.text("name"),
                drugClass,
                d.text("mechanism_of_action"),
                d.textList("known_contraindications"),
                d.textList("pharmacogenomic_markers"));
    }

    private static PatientPopulation population(JsonFieldReader root) {
        JsonFieldReader p = root.child("patient_population");
        String area = p.has("therapeutic_area") ? p.text("therapeutic_area") : root.text("therapeutic_area");
        return new PatientPopulation(
                p.text("age_range"),
                p.text("gender"),
                p.text("disease_indication"),
                area,
                p.textList("inclusion_criteria"),
                p.textList("exclusion_criteria"),
                p.text("disease_severity"),
                p.textList("biomarker_requirements"));
    }

    private static StudyDesign studyDesign(JsonFieldReader s) {
        return new StudyDesign(
                s.text("design_type"),
                s.text("blinding"),
                s.flag("randomization", false),
                s.flag("placebo_controlled", false),
                s.flag("placebo_run_in", false),
                s.flag("enrichment_design", false),
                s.flag("adaptive_design", false),
                s.integer("duration_weeks"));
    }

    private static StatisticalPlan statisticalPlan(JsonFieldReader s) {
        return new StatisticalPlan(
                s.integer("planned_enrollment", 0),
                s.integer("actual_enrollment"),
                s.flag("power_calculation_provided", false),
                s.decimal("expected_effect_size"),
                s.decimal("alpha_level", StatisticalPlan.DEFAULT_ALPHA),
                s.decimal("dropout_rate_assumption"),
                s.text("primary_analysis_method"));
    }

    /** Endpoint objects; a bare string is taken as the endpoint name. */
    private static List<Endpoint> endpoints(JsonFieldReader root, String field) {
        List<Endpoint> out = new ArrayList<>();
        for (JsonFieldReader e : root.children(field)) {
            if (e.node().isTextual()) {
                out.add(new Endpoint(e.node().asText(), null, null, null));
            } else if (e.isObject()) {
                out.add(new Endpoint(e.text("name"), e.text("type"), e.text("measurement_method"), e.text("timepoint")));
            } else if (!e.node().isNull()) {
                e.addError("expected an endpoint object");
            }
        }
        return out;
    }
}
