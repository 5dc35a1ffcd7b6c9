package com.z254.conductor.retrieval;

import com.z254.conductor.domain.model.CandidateDocument;
import com.z254.conductor.domain.model.SourceStrategy;
import com.z254.conductor.testing.fixtures.TestDataFactories;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link RelevanceScorer}.
 */
class RelevanceScorerTest {

    private static final Instant NOW = TestDataFactories.REFERENCE_INSTANT;

    @Test
    void addsCategoryMatchAsDomainBonus() {
        // Given
        CandidateDocument document = CandidateDocument.builder()
                .content("text")
                .sourceStrategy(SourceStrategy.CODE_EXAMPLES)
                .rawRelevance(1.0)
                .domain("other")
                .category("health-psychology")
                .build();

        // When
        double score = RelevanceScorer.score(document, List.of(), "health-psychology", NOW);

        // Then
        assertThat(score).isCloseTo(0.4 + 0.2 + 0.2, within(1e-9));
    }

    @Test
    void countsTermsFoundInTitleOrContent() {
        // Given
        CandidateDocument document = CandidateDocument.builder()
                .title("Resilience training")
                .content("A programme for adolescents")
                .build();

        // When
        double coverage = RelevanceScorer.termCoverage(document,
                List.of("resilience", "adolescents", "sleep", "parents"));

        // Then
        assertThat(coverage).isEqualTo(0.5);
    }

    @Test
    void recencyBonusFadesOverTwoYears() {
        assertThat(RelevanceScorer.recencyBonus(NOW, NOW)).isCloseTo(0.05, within(1e-9));
        assertThat(RelevanceScorer.recencyBonus(TestDataFactories.monthsBefore(NOW, 12), NOW))
                .isCloseTo(0.025, within(1e-9));
        assertThat(RelevanceScorer.recencyBonus(TestDataFactories.monthsBefore(NOW, 30), NOW)).isZero();
        assertThat(RelevanceScorer.recencyBonus(null, NOW)).isZero();
    }

    @Test
    void clampsToOne() {
        // Given
        CandidateDocument document = CandidateDocument.builder()
                .title("therapy")
                .content("therapy")
                .sourceStrategy(SourceStrategy.SPECIALIZED)
                .rawRelevance(1.0)
                .domain("clinical-psychology")
                .publishedAt(NOW)
                .build();

        // When
        double score = RelevanceScorer.score(document, List.of("therapy"), "clinical-psychology", NOW);

        // Then
        assertThat(score).isEqualTo(1.0);
    }

    @Test
    void usesDefaultsForMissingRelevanceAndSource() {
        CandidateDocument document = CandidateDocument.builder().content("plain").build();

        assertThat(RelevanceScorer.score(document, List.of(), null, NOW)).isCloseTo(0.2 + 0.2, within(1e-9));
    }
}
