package com.z254.conductor.retrieval.strategy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.conductor.client.KnowledgeQuery;
import com.z254.conductor.client.KnowledgeSourceClient;
import com.z254.conductor.config.ConductorProperties;
import com.z254.conductor.domain.model.CandidateDocument;
import com.z254.conductor.domain.model.SearchRequest;
import com.z254.conductor.domain.model.SourceStrategy;
import com.z254.conductor.observability.ConductorMetrics;
import com.z254.conductor.observability.StructuredLogger;
import com.z254.conductor.resilience.ExternalCallGuard;
import com.z254.conductor.resilience.FixedWindowRateLimiter;
import com.z254.conductor.retrieval.DomainSearchProfiles;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the knowledge source backed strategies.
 */
@ExtendWith(MockitoExtension.class)
class SpecializedContentSearchStrategyTest {

    @Mock
    private KnowledgeSourceClient client;

    private ConductorProperties properties;
    private ExternalCallGuard guard;
    private DomainSearchProfiles profiles;

    @BeforeEach
    void setUp() {
        properties = new ConductorProperties();
        profiles = new DomainSearchProfiles(properties);
        guard = new ExternalCallGuard(
                new FixedWindowRateLimiter(100, Duration.ofMinutes(1), Clock.systemUTC()),
                Bulkhead.ofDefaults("strategy-test"),
                Duration.ofSeconds(2),
                new ConductorMetrics(new SimpleMeterRegistry()),
                new StructuredLogger(new ObjectMapper()));
    }

    private static SearchRequest request(String domain, int matchCount) {
        return SearchRequest.builder().query("coping skills").domain(domain).matchCount(matchCount).build();
    }

    private static CandidateDocument result(String id) {
        return CandidateDocument.builder()
                .id(id)
                .content("content " + id)
                .sourceStrategy(SourceStrategy.KNOWLEDGE_BASE)
                .rawRelevance(0.9)
                .build();
    }

    @Test
    @DisplayName("should query once per leading priority term and retag results")
    void queriesPriorityTerms() {
        // Given
        when(client.searchKnowledgeBase(any())).thenAnswer(invocation -> {
            KnowledgeQuery query = invocation.getArgument(0);
            return Mono.just(List.of(result(query.getQuery())));
        });
        SpecializedContentSearchStrategy strategy =
                new SpecializedContentSearchStrategy(client, guard, profiles, properties);

        // When / Then
        StepVerifier.create(strategy.search(request("clinical-psychology", 5)))
                .assertNext(results -> {
                    assertThat(results).extracting(CandidateDocument::getId).containsExactly(
                            "coping skills evidence-based", "coping skills clinical-trial", "coping skills therapy");
                    assertThat(results).allMatch(d -> d.getSourceStrategy() == SourceStrategy.SPECIALIZED);
                })
                .verifyComplete();

        ArgumentCaptor<KnowledgeQuery> captor = ArgumentCaptor.forClass(KnowledgeQuery.class);
        verify(client, times(3)).searchKnowledgeBase(captor.capture());
        assertThat(captor.getAllValues()).allSatisfy(query -> {
            assertThat(query.getMatchCount()).isEqualTo(2);
            assertThat(query.getSourceFilter()).isEqualTo("clinical");
        });
    }

    @Test
    @DisplayName("should skip a failed lookup and keep the others")
    void toleratesFailedLookup() {
        // Given
        when(client.searchKnowledgeBase(any())).thenAnswer(invocation -> {
            KnowledgeQuery query = invocation.getArgument(0);
            return query.getQuery().endsWith("clinical-trial")
                    ? Mono.error(new IllegalStateException("source down"))
                    : Mono.just(List.of(result(query.getQuery())));
        });
        SpecializedContentSearchStrategy strategy =
                new SpecializedContentSearchStrategy(client, guard, profiles, properties);

        // When / Then
        StepVerifier.create(strategy.search(request("clinical-psychology", 5)))
                .assertNext(results -> assertThat(results).hasSize(2))
                .verifyComplete();
    }

    @Test
    @DisplayName("should return nothing for a domain without a profile")
    void unknownDomain() {
        SpecializedContentSearchStrategy strategy =
                new SpecializedContentSearchStrategy(client, guard, profiles, properties);

        StepVerifier.create(strategy.search(request("social-psychology", 5)))
                .assertNext(results -> assertThat(results).isEmpty())
                .verifyComplete();

        verify(client, never()).searchKnowledgeBase(any());
    }

    @Test
    @DisplayName("should request half the match count for code examples")
    void codeExamplesHalveMatchCount() {
        // Given
        when(client.searchCodeExamples(any())).thenReturn(Mono.just(List.of()));
        CodeExampleSearchStrategy strategy = new CodeExampleSearchStrategy(client, guard, profiles);

        // When
        strategy.search(request("educational-psychology", 5)).block();

        // Then
        ArgumentCaptor<KnowledgeQuery> captor = ArgumentCaptor.forClass(KnowledgeQuery.class);
        verify(client).searchCodeExamples(captor.capture());
        assertThat(captor.getValue().getMatchCount()).isEqualTo(3);
        assertThat(captor.getValue().getSourceFilter()).isEqualTo("education");
    }

    @Test
    @DisplayName("should pass the full match count to the knowledge base")
    void knowledgeBaseUsesMatchCount() {
        // Given
        when(client.searchKnowledgeBase(any())).thenReturn(Mono.just(List.of(result("a"))));
        KnowledgeBaseSearchStrategy strategy = new KnowledgeBaseSearchStrategy(client, guard, profiles);

        // When / Then
        StepVerifier.create(strategy.search(request("positive-psychology", 4)))
                .assertNext(results -> assertThat(results).hasSize(1))
                .verifyComplete();

        ArgumentCaptor<KnowledgeQuery> captor = ArgumentCaptor.forClass(KnowledgeQuery.class);
        verify(client).searchKnowledgeBase(captor.capture());
        assertThat(captor.getValue().getMatchCount()).isEqualTo(4);
        assertThat(captor.getValue().getSourceFilter()).isEqualTo("wellbeing");
    }
}
