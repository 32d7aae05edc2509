package com.goormthonuniv.trialguard.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.trialguard.corpus.CorpusLoader;
import com.goormthonuniv.trialguard.corpus.CorpusRegistry;
import com.goormthonuniv.trialguard.dto.FailurePattern;
import com.goormthonuniv.trialguard.dto.TrialFilter;
import com.goormthonuniv.trialguard.dto.TrialOutcome;
import com.goormthonuniv.trialguard.dto.TrialPhase;
import com.goormthonuniv.trialguard.dto.TrialRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;
import java.util.Map;

import static com.goormthonuniv.trialguard.support.TrialBuilder.trial;
import static org.assertj.core.api.Assertions.assertThat;

class TrialCatalogServiceTest {

    private TrialCatalogService catalog;

    @BeforeEach
    void setUp() {
        CorpusRegistry registry = new CorpusRegistry(
                new CorpusLoader(new ObjectMapper(), new DefaultResourceLoader()), "classpath:none.json");
        registry.replace(
                List.of(
                        trial("NCT1").drugClass("SSRI").area("Psychiatry").phase(TrialPhase.PHASE_3).failed().build(),
                        trial("NCT2").drugClass("SNRI").area("Psychiatry").phase(TrialPhase.PHASE_2).build(),
                        trial("NCT3").drugClass("SSRI (sertraline)").area("Child Psychiatry").phase(TrialPhase.PHASE_3).build(),
                        trial("NCT4").drugClass("PD-1 Inhibitor").area("Oncology").phase(TrialPhase.PHASE_3).failed().build()),
                Map.of(
                        "psychiatry", new FailurePattern("psychiatry", 0.5, List.of("placebo"), List.of()),
                        "psychiatry_ssri", new FailurePattern("psychiatry_ssri", 0.6, List.of(), List.of())));
        catalog = new TrialCatalogService(registry);
    }

    @Test
    void findByIdShouldReturnTheRecord() {
        assertThat(catalog.findById("NCT2")).map(TrialRecord::drugClass).contains("SNRI");
        assertThat(catalog.findById("NCT404")).isEmpty();
    }

    @Nested
    @DisplayName("filter")
    class Filter {

        @Test
        void shouldMatchDrugClassSubstringsInCorpusOrder() {
            List<TrialRecord> result = catalog.filter(new TrialFilter("ssri", null, null, null, 20));

            assertThat(result).extracting(TrialRecord::nctId).containsExactly("NCT1", "NCT3");
        }

        @Test
        void shouldMatchAreaContainedInTrialArea() {
            List<TrialRecord> result = catalog.filter(new TrialFilter(null, "psychiatry", null, null, 20));

            assertThat(result).extracting(TrialRecord::nctId).containsExactly("NCT1", "NCT2", "NCT3");
        }

        @Test
        void shouldCombinePhaseAndOutcome() {
            List<TrialRecord> result = catalog.filter(
                    new TrialFilter(null, null, TrialPhase.PHASE_3, TrialOutcome.FAILED, 20));

            assertThat(result).extracting(TrialRecord::nctId).containsExactly("NCT1", "NCT4");
        }

        @Test
        void shouldApplyTheLimit() {
            assertThat(catalog.filter(new TrialFilter(null, null, null, null, 2))).hasSize(2);
            assertThat(catalog.filter(TrialFilter.all())).hasSize(4);
            assertThat(catalog.filter(null)).hasSize(4);
        }
    }

    @Test
    void failurePatternShouldPreferAreaAndDrugClassKey() {
        assertThat(catalog.failurePattern("Psychiatry", "SSRI")).map(FailurePattern::failureRate).contains(0.6);
        assertThat(catalog.failurePattern("Psychiatry", null)).map(FailurePattern::failureRate).contains(0.5);
        assertThat(catalog.failurePattern("Psychiatry", "SNRI")).isEmpty();
        assertThat(catalog.failurePattern(null, "SSRI")).isEmpty();
    }
}
