package com.z254.conductor.retrieval;

import com.z254.conductor.domain.model.CandidateDocument;
import com.z254.conductor.testing.time.ManualTicker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RetrievalCache}.
 */
class RetrievalCacheTest {

    private ManualTicker ticker;
    private RetrievalCache cache;

    @BeforeEach
    void setUp() {
        ticker = new ManualTicker();
        cache = new RetrievalCache(Duration.ofMinutes(5), 100, ticker);
    }

    @Test
    void servesEntriesUntilTheTtlElapses() {
        // Given
        cache.put("key", List.of(CandidateDocument.builder().id("a").build()));

        // When
        ticker.advance(Duration.ofMinutes(4));

        // Then
        assertThat(cache.get("key")).isPresent();

        ticker.advance(Duration.ofMinutes(1));
        assertThat(cache.get("key")).isEmpty();
    }

    @Test
    void storesImmutableSnapshots() {
        // Given
        List<CandidateDocument> results = new ArrayList<>();
        results.add(CandidateDocument.builder().id("a").build());

        // When
        List<CandidateDocument> stored = cache.put("key", results);
        results.add(CandidateDocument.builder().id("b").build());

        // Then
        assertThat(cache.get("key")).get().isSameAs(stored);
        assertThat(stored).hasSize(1);
        assertThatThrownBy(() -> stored.add(CandidateDocument.builder().build()))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void invalidatesEverything() {
        cache.put("one", List.of());
        cache.put("two", List.of());

        cache.invalidateAll();

        assertThat(cache.size()).isZero();
    }
}
