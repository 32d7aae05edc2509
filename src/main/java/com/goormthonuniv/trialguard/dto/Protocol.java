package com.goormthonuniv.trialguard.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

/**
 * The candidate protocol under analysis. Missing sections are replaced with empty ones
 * so the engine never has to null-check a section.
 */
public record Protocol(
        @Valid ProtocolMetadata metadata,
        @Valid DrugProfile drugProfile,
        @Valid PatientPopulation patientPopulation,
        @Valid StudyDesign studyDesign,
        @Valid StatisticalPlan statisticalPlan,
        String safetyMonitoringPlan,
        List<Endpoint> primaryEndpoints,
        List<Endpoint> secondaryEndpoints
) {
    public Protocol {
        metadata = metadata == null ? ProtocolMetadata.empty() : metadata;
        drugProfile = drugProfile == null ? DrugProfile.empty() : drugProfile;
        patientPopulation = patientPopulation == null ? PatientPopulation.empty() : patientPopulation;
        studyDesign = studyDesign == null ? StudyDesign.empty() : studyDesign;
        statisticalPlan = statisticalPlan == null ? StatisticalPlan.empty() : statisticalPlan;
        primaryEndpoints = primaryEndpoints == null ? List.of() : List.copyOf(primaryEndpoints);
        secondaryEndpoints = secondaryEndpoints == null ? List.of() : List.copyOf(secondaryEndpoints);
    }

    public record ProtocolMetadata(
            String nctId,
            String trialName,
            String sponsor,
            TrialPhase phase,
            Integer year
    ) {
        public static ProtocolMetadata empty() {
            return new ProtocolMetadata(null, null, null, null, null);
        }
    }

    public record DrugProfile(
            String name,
            String drugClass,
            String mechanismOfAction,
            List<String> knownContraindications,
            List<String> pharmacogenomicMarkers   // e.g. "CYP2D6"
    ) {
        public DrugProfile {
            knownContraindications = knownContraindications == null ? List.of() : List.copyOf(knownContraindications);
            pharmacogenomicMarkers = pharmacogenomicMarkers == null ? List.of() : List.copyOf(pharmacogenomicMarkers);
        }

        public static DrugProfile empty() {
            return new DrugProfile(null, null, null, null, null);
        }
    }

    public record PatientPopulation(
            String ageRange,
            String gender,
            String diseaseIndication,
            String therapeuticArea,
            List<String> inclusionCriteria,
            List<String> exclusionCriteria,
            String diseaseSeverity,
            List<String> biomarkerRequirements
    ) {
        public PatientPopulation {
            inclusionCriteria = inclusionCriteria == null ? List.of() : List.copyOf(inclusionCriteria);
            exclusionCriteria = exclusionCriteria == null ? List.of() : List.copyOf(exclusionCriteria);
            biomarkerRequirements = biomarkerRequirements == null ? List.of() : List.copyOf(biomarkerRequirements);
        }

        public static PatientPopulation empty() {
            return new PatientPopulation(null, null, null, null, null, null, null, null);
        }
    }

    public record StudyDesign(
            String designType,            // Parallel | Crossover | Factorial | Single Group
            String blinding,              // open-label | single-blind | double-blind | triple-blind
            boolean randomization,
            boolean placeboControlled,
            boolean placeboRunIn,
            boolean enrichmentDesign,
            boolean adaptiveDesign,
            @Positive Integer durationWeeks
    ) {
        public static StudyDesign empty() {
            return new StudyDesign(null, null, false, false, false, false, false, null);
        }
    }

    public record StatisticalPlan(
            @PositiveOrZero int plannedEnrollment,
            @PositiveOrZero Integer actualEnrollment,
            boolean powerCalculationProvided,
            Double expectedEffectSize,
            @DecimalMin(value = "0.0", inclusive = false)
            @DecimalMax("1.0") double alphaLevel,
            @DecimalMin("0.0")
            @DecimalMax("1.0") Double dropoutRateAssumption,
            String primaryAnalysisMethod
    ) {
        public static final double DEFAULT_ALPHA = 0.05;

        public static StatisticalPlan empty() {
            return new StatisticalPlan(0, null, false, null, DEFAULT_ALPHA, null, null);
        }
    }

    public record Endpoint(
            String name,
            String type,                  // primary | secondary | exploratory
            String measurementMethod,
            String timepoint
    ) {}
}
