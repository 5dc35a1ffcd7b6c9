package com.z254.conductor.client.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.z254.conductor.client.KnowledgeQuery;
import com.z254.conductor.client.KnowledgeSourceClient;
import com.z254.conductor.config.ConductorProperties;
import com.z254.conductor.domain.model.CandidateDocument;
import com.z254.conductor.domain.model.SourceStrategy;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * WebClient-based implementation of KnowledgeSourceClient.
 * Uses circuit breaker and retry for resilience.
 */
@Component
@ConditionalOnProperty(name = "conductor.source.mode", havingValue = "remote")
@Slf4j
public class WebClientKnowledgeSourceClient implements KnowledgeSourceClient {

    private final WebClient webClient;
    private final ConductorProperties.SourceProperties config;
    private final Clock clock;

    public WebClientKnowledgeSourceClient(WebClient.Builder webClientBuilder,
                                          ConductorProperties conductorProperties,
                                          Clock clock) {
        this.config = conductorProperties.getSource();
        this.clock = clock;
        if (config.getBaseUrl() == null || config.getBaseUrl().isEmpty()) {
            throw new IllegalStateException("conductor.source.base-url is required when conductor.source.mode=remote");
        }
        this.webClient = webClientBuilder
                .baseUrl(config.getBaseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    @CircuitBreaker(name = "knowledgeSource")
    @Retry(name = "knowledgeSource")
    public Mono<List<CandidateDocument>> searchKnowledgeBase(KnowledgeQuery query) {
        return search(config.getKnowledgeBasePath(), query, SourceStrategy.KNOWLEDGE_BASE);
    }

    @Override
    @CircuitBreaker(name = "knowledgeSource")
    @Retry(name = "knowledgeSource")
    public Mono<List<CandidateDocument>> searchCodeExamples(KnowledgeQuery query) {
        return search(config.getCodeExamplesPath(), query, SourceStrategy.CODE_EXAMPLES);
    }

    private Mono<List<CandidateDocument>> search(String path, KnowledgeQuery query, SourceStrategy source) {
        Map<String, Object> body = new HashMap<>();
        body.put("query", query.getQuery());
        body.put("match_count", query.getMatchCount());
        if (query.getSourceFilter() != null) {
            body.put("source_domain", query.getSourceFilter());
        }

        return webClient.post()
                .uri(path)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(SearchResponse.class)
                .timeout(config.getTimeout())
                .map(response -> toDocuments(response, query, source))
                .doOnSuccess(docs -> log.debug("Knowledge source returned {} {} documents", docs.size(), source.getWireName()))
                .doOnError(e -> log.error("Knowledge source {} search failed: {}", source.getWireName(), e.getMessage()));
    }

    private List<CandidateDocument> toDocuments(SearchResponse response, KnowledgeQuery query, SourceStrategy source) {
        if (!response.isSuccess() || response.getResults() == null) {
            return List.of();
        }
        Instant now = clock.instant();
        List<CandidateDocument> documents = new ArrayList<>();
        for (RemoteDocument doc : response.getResults()) {
            documents.add(CandidateDocument.builder()
                    .id(doc.getId())
                    .title(doc.getTitle())
                    .content(doc.getContent() != null ? doc.getContent() : doc.getSummary())
                    .sourceStrategy(source)
                    .domain(doc.getDomain())
                    .rawRelevance(doc.getRelevance() != null ? doc.getRelevance() : doc.getScore())
                    .categories(doc.getCategories() != null ? doc.getCategories() : List.of())
                    .url(doc.getUrl())
                    .publishedAt(doc.getDate())
                    .retrievedAt(now)
                    .build());
        }
        return documents;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SearchResponse {
        private boolean success;
        private List<RemoteDocument> results;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class RemoteDocument {
        private String id;
        private String title;
        private String content;
        private String summary;
        private String domain;
        private Double relevance;
        @JsonProperty("similarity_score")
        private Double score;
        private List<String> categories;
        private String url;
        private Instant date;
    }
}
