package com.z254.conductor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.conductor.observability.ConductorMetrics;
import com.z254.conductor.observability.StructuredLogger;
import com.z254.conductor.resilience.ExternalCallGuard;
import com.z254.conductor.resilience.FixedWindowRateLimiter;
import com.z254.conductor.retrieval.KnowledgeContextBuilder;
import com.z254.conductor.retrieval.KnowledgeRetrievalService;
import com.z254.conductor.retrieval.QueryEnhancer;
import com.z254.conductor.retrieval.ResultRanker;
import com.z254.conductor.retrieval.RetrievalCache;
import com.z254.conductor.retrieval.SearchHistory;
import com.z254.conductor.retrieval.SearchStrategy;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Wiring for knowledge retrieval and the shared external API guard.
 */
@Configuration
public class RetrievalConfig {

    public static final String EXTERNAL_API_BULKHEAD = "external-api";

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ==================== External API ====================

    @Bean
    public FixedWindowRateLimiter externalApiRateLimiter(ConductorProperties properties, Clock clock) {
        ConductorProperties.ExternalApiProperties config = properties.getExternalApi();
        return new FixedWindowRateLimiter(config.getMaxRequestsPerWindow(), config.getRateLimitWindow(), clock);
    }

    @Bean
    public Bulkhead externalApiBulkhead(ConductorProperties properties) {
        ConductorProperties.ExternalApiProperties config = properties.getExternalApi();
        return Bulkhead.of(EXTERNAL_API_BULKHEAD, BulkheadConfig.custom()
                .maxConcurrentCalls(config.getMaxConcurrentRequests())
                .maxWaitDuration(config.getSlotWaitTimeout())
                .build());
    }

    @Bean
    public ExternalCallGuard externalCallGuard(FixedWindowRateLimiter externalApiRateLimiter,
                                               Bulkhead externalApiBulkhead,
                                               ConductorProperties properties,
                                               ConductorMetrics metrics,
                                               StructuredLogger structuredLogger,
                                               Clock clock) {
        return new ExternalCallGuard(externalApiRateLimiter, externalApiBulkhead,
                properties.getExternalApi().getTimeout(), metrics, structuredLogger, clock);
    }

    // ==================== Retrieval ====================

    @Bean
    public ResultRanker resultRanker(ConductorProperties properties, Clock clock) {
        return new ResultRanker(properties.getRetrieval().getRelevanceThreshold(), clock);
    }

    @Bean
    public RetrievalCache retrievalCache(ConductorProperties properties) {
        ConductorProperties.RetrievalProperties config = properties.getRetrieval();
        return new RetrievalCache(config.getCacheTtl(), config.getMaxCacheEntries());
    }

    @Bean
    public SearchHistory searchHistory(ConductorProperties properties) {
        return new SearchHistory(properties.getRetrieval().getHistorySize());
    }

    @Bean
    public KnowledgeRetrievalService knowledgeRetrievalService(List<SearchStrategy> strategies,
                                                               QueryEnhancer queryEnhancer,
                                                               ResultRanker resultRanker,
                                                               RetrievalCache retrievalCache,
                                                               SearchHistory searchHistory,
                                                               KnowledgeContextBuilder contextBuilder,
                                                               ConductorMetrics metrics,
                                                               StructuredLogger structuredLogger,
                                                               ConductorProperties properties,
                                                               ObjectMapper objectMapper,
                                                               Clock clock) {
        return new KnowledgeRetrievalService(strategies, queryEnhancer, resultRanker, retrievalCache, searchHistory,
                contextBuilder, metrics, structuredLogger, properties, objectMapper, clock);
    }
}
