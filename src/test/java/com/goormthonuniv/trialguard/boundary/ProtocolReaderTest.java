package com.goormthonuniv.trialguard.boundary;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.trialguard.dto.Protocol;
import com.goormthonuniv.trialguard.dto.TrialPhase;
import com.goormthonuniv.trialguard.exception.InvalidInputException;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.InstanceOfAssertFactories.list;

class ProtocolReaderTest {

    private static ValidatorFactory validatorFactory;
    private static ProtocolReader reader;

    @BeforeAll
    static void setUp() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        reader = new ProtocolReader(new ObjectMapper(), validatorFactory.getValidator());
    }

    @AfterAll
    static void tearDown() {
        validatorFactory.close();
    }

    @Nested
    @DisplayName("well-formed documents")
    class WellFormed {

        @Test
        void shouldMapNestedSnakeCaseSections() {
            Protocol p = reader.read("""
                    {
                      "metadata": { "nct_id": "NCT05000001", "trial_name": "Candidate", "phase": "phase 3", "year": 2025 },
                      "drug_profile": { "name": "X-101", "drug_class": "SSRI", "known_contraindications": ["MAOI use"],
                                        "pharmacogenomic_markers": ["CYP2D6"] },
                      "patient_population": { "age_range": "18-65", "therapeutic_area": "Psychiatry",
                                              "exclusion_criteria": ["Pregnancy"] },
                      "study_design": { "design_type": "Parallel", "blinding": "double-blind",
                                        "placebo_controlled": true, "placebo_run_in": true, "duration_weeks": 8 },
                      "statistical_plan": { "planned_enrollment": 320, "power_calculation_provided": true,
                                            "alpha_level": 0.025, "dropout_rate_assumption": 0.2 },
                      "safety_monitoring_plan": "DSMB every 8 weeks",
                      "primary_endpoints": [ { "name": "MADRS", "timepoint": "Week 8" }, "HAM-D" ]
                    }
                    """);

            assertThat(p.metadata().phase()).isEqualTo(TrialPhase.PHASE_3);
            assertThat(p.drugProfile().drugClass()).isEqualTo("SSRI");
            assertThat(p.drugProfile().pharmacogenomicMarkers()).containsExactly("CYP2D6");
            assertThat(p.patientPopulation().therapeuticArea()).isEqualTo("Psychiatry");
            assertThat(p.studyDesign().placeboRunIn()).isTrue();
            assertThat(p.statisticalPlan().plannedEnrollment()).isEqualTo(320);
            assertThat(p.statisticalPlan().alphaLevel()).isEqualTo(0.025);
            assertThat(p.primaryEndpoints()).extracting(Protocol.Endpoint::name).containsExactly("MADRS", "HAM-D");
        }

        @Test
        void shouldFillDefaultsForAbsentFields() {
            Protocol p = reader.read("{}");

            assertThat(p.metadata().phase()).isNull();
            assertThat(p.drugProfile().knownContraindications()).isEmpty();
            assertThat(p.studyDesign().placeboControlled()).isFalse();
            assertThat(p.statisticalPlan().plannedEnrollment()).isZero();
            assertThat(p.statisticalPlan().alphaLevel()).isEqualTo(0.05);
            assertThat(p.primaryEndpoints()).isEmpty();
            assertThat(p.safetyMonitoringPlan()).isNull();
        }

        @Test
        void shouldAcceptFlatTopLevelFallbacks() {
            Protocol p = reader.read("""
                    { "phase": "Phase 2", "drug_class": "SNRI", "therapeutic_area": "Psychiatry" }
                    """);

            assertThat(p.metadata().phase()).isEqualTo(TrialPhase.PHASE_2);
            assertThat(p.drugProfile().drugClass()).isEqualTo("SNRI");
            assertThat(p.patientPopulation().therapeuticArea()).isEqualTo("Psychiatry");
        }
    }

    @Nested
    @DisplayName("malformed documents")
    class Malformed {

        @Test
        void shouldReportEveryWrongTypeAtOnce() {
            assertThatThrownBy(() -> reader.read("""
                    { "metadata": { "phase": "Phase 7" },
                      "statistical_plan": { "planned_enrollment": "lots", "power_calculation_provided": "yes" } }
                    """))
                    .isInstanceOf(InvalidInputException.class)
                    .extracting(e -> ((InvalidInputException) e).getErrors(), list(String.class))
                    .containsExactly(
                            "metadata.phase: unknown value 'Phase 7'",
                            "statistical_plan.planned_enrollment: expected an integer but was string",
                            "statistical_plan.power_calculation_provided: expected a boolean but was string");
        }

        @Test
        void shouldRejectConstraintViolations() {
            assertThatThrownBy(() -> reader.read("""
                    { "statistical_plan": { "planned_enrollment": -5, "alpha_level": 1.5 } }
                    """))
                    .isInstanceOf(InvalidInputException.class)
                    .hasMessageContaining("statisticalPlan.plannedEnrollment")
                    .hasMessageContaining("statisticalPlan.alphaLevel");
        }

        @Test
        void shouldRejectNonObjectDocuments() {
            assertThatThrownBy(() -> reader.read("[1, 2, 3]"))
                    .isInstanceOf(InvalidInputException.class)
                    .hasMessage("Invalid protocol: expected a JSON object");
        }

        @Test
        void shouldRejectInvalidJson() {
            assertThatThrownBy(() -> reader.read("{ not json"))
                    .isInstanceOf(InvalidInputException.class)
                    .hasMessageStartingWith("Invalid protocol: not valid JSON");
        }
    }
}
