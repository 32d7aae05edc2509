package com.goormthonuniv.trialguard;

import com.goormthonuniv.trialguard.boundary.FindingReader;
import com.goormthonuniv.trialguard.boundary.ProtocolReader;
import com.goormthonuniv.trialguard.corpus.CorpusRegistry;
import com.goormthonuniv.trialguard.dto.Protocol;
import com.goormthonuniv.trialguard.dto.RiskAssessment;
import com.goormthonuniv.trialguard.exception.InvalidInputException;
import com.goormthonuniv.trialguard.search.SearchQuery;
import com.goormthonuniv.trialguard.search.TrialSearchService;
import com.goormthonuniv.trialguard.service.RiskAssessmentService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(properties = "trialguard.search.default-top-k=3")
class TrialGuardApplicationTests {

    @Autowired
    private CorpusRegistry corpusRegistry;

    @Autowired
    private TrialSearchService searchService;

    @Autowired
    private ProtocolReader protocolReader;

    @Autowired
    private FindingReader findingReader;

    @Autowired
    private RiskAssessmentService assessmentService;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void shouldLoadTheBundledCorpus() {
        assertThat(corpusRegistry.current().isEmpty()).isFalse();
        assertThat(corpusRegistry.current().findById("NCT02134613")).isPresent();
        assertThat(corpusRegistry.current().failurePattern("psychiatry_ssri")).isPresent();
    }

    @Test
    void shouldApplyConfiguredTopK() {
        assertThat(searchService.defaultTopK()).isEqualTo(3);
        assertThat(searchService.search(SearchQuery.of("PD-1 Inhibitor").withTopK(searchService.defaultTopK())))
                .hasSizeLessThanOrEqualTo(3)
                .isNotEmpty();
    }

    @Test
    void shouldAssessAProtocolReadFromJson() throws Exception {
        Protocol protocol = protocolReader.read("""
                {
                  "metadata": { "trial_name": "Candidate SSRI Study", "phase": "Phase 3" },
                  "drug_profile": { "drug_class": "SSRI" },
                  "patient_population": { "age_range": "18-65", "therapeutic_area": "Psychiatry" },
                  "study_design": { "blinding": "double-blind", "placebo_controlled": true },
                  "statistical_plan": { "planned_enrollment": 300, "power_calculation_provided": true },
                  "primary_endpoints": ["MADRS change at week 8"]
                }
                """);
        var findings = findingReader.readAll(objectMapper.readTree("""
                [ { "title": "No placebo run-in", "severity": "critical", "implementation_difficulty": "easy" } ]
                """));

        RiskAssessment assessment = assessmentService.assess(protocol, findings);

        assertThat(assessment.similarTrials()).isNotEmpty().hasSizeLessThanOrEqualTo(3);
        assertThat(assessment.similarTrials().get(0).trial().drugClass()).isEqualTo("SSRI");
        assertThat(assessment.riskScore().overallScore()).isBetween(0.0, 100.0);
        assertThat(assessment.comparisons()).hasSizeLessThanOrEqualTo(3);
        assertThat(assessment.recommendations()).hasSize(1);
        assertThat(assessment.failurePattern()).isNotNull();
    }

    @Test
    void springValidatorShouldBackTheProtocolReader() {
        assertThatThrownBy(() -> protocolReader.read("{ \"statistical_plan\": { \"alpha_level\": 0 } }"))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("alphaLevel");
    }
}
