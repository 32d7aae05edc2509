package com.goormthonuniv.trialguard.search;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.trialguard.corpus.CorpusLoader;
import com.goormthonuniv.trialguard.corpus.CorpusRegistry;
import com.goormthonuniv.trialguard.dto.ScoredTrial;
import com.goormthonuniv.trialguard.dto.TrialPhase;
import com.goormthonuniv.trialguard.dto.TrialRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;

import static com.goormthonuniv.trialguard.support.TrialBuilder.trial;
import static org.assertj.core.api.Assertions.assertThat;

class TrialSearchServiceTest {

    private CorpusRegistry registry;
    private TrialSearchService searchService;

    @BeforeEach
    void setUp() {
        registry = new CorpusRegistry(new CorpusLoader(new ObjectMapper(), new DefaultResourceLoader()), "classpath:none.json");
        searchService = new TrialSearchService(registry, new SimilarityScorer(), 5, 100, 15);
    }

    private void corpus(TrialRecord... trials) {
        registry.replace(List.of(trials));
    }

    @Nested
    @DisplayName("result shape")
    class ResultShape {

        @Test
        void shouldReturnAtMostKResultsSortedByScore() {
            corpus(
                    trial("NCT1").drugClass("SSRI").area("Neurology").phase(TrialPhase.PHASE_1).build(),
                    trial("NCT2").drugClass("SSRI").area("Psychiatry").phase(TrialPhase.PHASE_3).build(),
                    trial("NCT3").drugClass("SSRI").area("Psychiatry").phase(TrialPhase.PHASE_2).build(),
                    trial("NCT4").drugClass("SSRI-like").area("Psychiatry").phase(TrialPhase.PHASE_3).build());

            List<ScoredTrial> results = searchService.search("SSRI", "Psychiatry", TrialPhase.PHASE_3, null, 3);

            assertThat(results).hasSize(3);
            assertThat(results).extracting(ScoredTrial::similarityScore)
                    .allSatisfy(s -> assertThat(s).isBetween(0.0, 1.0))
                    .isSortedAccordingTo((a, b) -> Double.compare(b, a));
            assertThat(results.get(0).trial().nctId()).isEqualTo("NCT2");
        }

        @Test
        void tiesShouldKeepCorpusOrder() {
            corpus(
                    trial("NCT1").drugClass("SSRI").build(),
                    trial("NCT2").drugClass("SSRI").build(),
                    trial("NCT3").drugClass("SSRI").build());

            List<ScoredTrial> results = searchService.search(SearchQuery.of("SSRI"));

            assertThat(results).extracting(s -> s.trial().nctId()).containsExactly("NCT1", "NCT2", "NCT3");
        }

        @Test
        void shouldUseConfiguredDefaultTopK() {
            corpus(
                    trial("NCT1").build(), trial("NCT2").build(), trial("NCT3").build(),
                    trial("NCT4").build(), trial("NCT5").build(), trial("NCT6").build());

            assertThat(searchService.search("SSRI", null, null, null)).hasSize(5);
        }
    }

    @Nested
    @DisplayName("candidate generation")
    class Candidates {

        @Test
        void shouldMatchDrugClassSubstringsInEitherDirection() {
            corpus(
                    trial("NCT1").drugClass("SSRI (escitalopram)").build(),
                    trial("NCT2").drugClass("SNRI").build(),
                    trial("NCT3").drugClass("ssri").build());

            List<ScoredTrial> results = searchService.search(SearchQuery.of("SSRI"));

            assertThat(results).extracting(s -> s.trial().nctId()).containsExactly("NCT3", "NCT1");
        }

        @Test
        void shouldNarrowByAreaWhenEnoughCandidatesRemain() {
            corpus(
                    trial("NCT1").drugClass("SSRI").area("Neurology").build(),
                    trial("NCT2").drugClass("SSRI").area("Psychiatry").build());

            List<ScoredTrial> results = searchService.search("SSRI", "Psychiatry", null, null, 1);

            assertThat(results).extracting(s -> s.trial().nctId()).containsExactly("NCT2");
            assertThat(TrialSearchService.candidates(registry.current(), new SearchQuery("SSRI", "Psychiatry", null, null, 1))
                    .cardinality()).isEqualTo(1);
        }

        @Test
        void shouldFallBackToDrugClassCandidatesWhenAreaLeavesTooFew() {
            corpus(
                    trial("NCT1").drugClass("SSRI").area("Neurology").build(),
                    trial("NCT2").drugClass("SSRI").area("Psychiatry").build());

            List<ScoredTrial> results = searchService.search("SSRI", "Psychiatry", null, null, 5);

            assertThat(results).extracting(s -> s.trial().nctId()).containsExactly("NCT2", "NCT1");
        }

        @Test
        void shouldFallBackWhenAreaIsUnknown() {
            corpus(trial("NCT1").drugClass("SSRI").area("Neurology").build());

            assertThat(searchService.search("SSRI", "Dermatology", null, null, 5)).hasSize(1);
        }

        @Test
        void blankDrugClassShouldBeSearchedAsUnknown() {
            corpus(
                    trial("NCT1").drugClass("SSRI").build(),
                    trial("NCT2").drugClass("Unknown").build());

            List<ScoredTrial> results = searchService.search("  ", null, null, null);

            assertThat(results).extracting(s -> s.trial().nctId()).containsExactly("NCT2");
        }
    }

    @Nested
    @DisplayName("degenerate input")
    class Degenerate {

        @Test
        void emptyCorpusShouldReturnEmptyList() {
            assertThat(searchService.search("SSRI", "Psychiatry", TrialPhase.PHASE_3, "18-65")).isEmpty();
        }

        @Test
        void nonPositiveTopKShouldReturnEmptyList() {
            corpus(trial("NCT1").build());

            assertThat(searchService.search("SSRI", null, null, null, 0)).isEmpty();
            assertThat(searchService.search("SSRI", null, null, null, -3)).isEmpty();
        }

        @Test
        void unmatchedDrugClassShouldReturnEmptyList() {
            corpus(trial("NCT1").drugClass("SSRI").build());

            assertThat(searchService.search(SearchQuery.of("Monoclonal Antibody"))).isEmpty();
        }
    }

    @Test
    void replacedCorpusShouldNeverServeCachedResults() {
        corpus(trial("NCT1").drugClass("SSRI").build());
        assertThat(searchService.search(SearchQuery.of("SSRI"))).hasSize(1);

        corpus(trial("NCT2").drugClass("SSRI").build(), trial("NCT3").drugClass("SSRI").build());

        assertThat(searchService.search(SearchQuery.of("SSRI")))
                .extracting(s -> s.trial().nctId())
                .containsExactly("NCT2", "NCT3");
    }
}
