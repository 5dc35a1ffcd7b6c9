package com.z254.conductor.retrieval;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.z254.conductor.config.ConductorProperties;
import com.z254.conductor.domain.model.CandidateDocument;
import com.z254.conductor.domain.model.KnowledgeContext;
import com.z254.conductor.domain.model.OrchestratorStatus;
import com.z254.conductor.domain.model.SearchRecord;
import com.z254.conductor.domain.model.SearchRequest;
import com.z254.conductor.observability.ConductorMetrics;
import com.z254.conductor.observability.StructuredLogger;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Entry point for knowledge retrieval.
 * <p>
 * Serves identical searches from cache within the TTL window. On a miss it enhances
 * the query for the domain, runs every strategy concurrently, ranks the combined
 * results and caches them. Never signals an error: a failed search yields an empty list.
 */
@Slf4j
public class KnowledgeRetrievalService {

    public static final String OPTION_MATCH_COUNT = "matchCount";

    private final List<SearchStrategy> strategies;
    private final QueryEnhancer queryEnhancer;
    private final ResultRanker ranker;
    private final RetrievalCache cache;
    private final SearchHistory history;
    private final KnowledgeContextBuilder contextBuilder;
    private final ConductorMetrics metrics;
    private final StructuredLogger structuredLogger;
    private final ConductorProperties.RetrievalProperties config;
    private final ObjectMapper keyMapper;
    private final Clock clock;

    public KnowledgeRetrievalService(List<SearchStrategy> strategies,
                                     QueryEnhancer queryEnhancer,
                                     ResultRanker ranker,
                                     RetrievalCache cache,
                                     SearchHistory history,
                                     KnowledgeContextBuilder contextBuilder,
                                     ConductorMetrics metrics,
                                     StructuredLogger structuredLogger,
                                     ConductorProperties conductorProperties,
                                     ObjectMapper objectMapper,
                                     Clock clock) {
        this.strategies = strategies.stream()
                .sorted(Comparator.comparingInt(s -> s.getSource().ordinal()))
                .collect(Collectors.toList());
        this.queryEnhancer = queryEnhancer;
        this.ranker = ranker;
        this.cache = cache;
        this.history = history;
        this.contextBuilder = contextBuilder;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.config = conductorProperties.getRetrieval();
        this.keyMapper = objectMapper.copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        this.clock = clock;
    }

    /**
     * Search with the default match count.
     */
    public Mono<List<CandidateDocument>> search(String query, String domain) {
        return search(query, domain, Map.of());
    }

    /**
     * @param options may carry {@value #OPTION_MATCH_COUNT}; all entries take part in the cache key
     */
    public Mono<List<CandidateDocument>> search(String query, String domain, Map<String, Object> options) {
        String rawQuery = query != null ? query : "";
        Map<String, Object> searchOptions = options != null ? options : Map.of();
        int matchCount = resolveMatchCount(searchOptions);
        String searchId = "search_" + UUID.randomUUID().toString().substring(0, 8);
        long start = clock.millis();

        return Mono.defer(() -> {
                    metrics.searchStarted();
                    String cacheKey = cacheKey(rawQuery, domain, matchCount, searchOptions);

                    if (config.isCacheEnabled()) {
                        Optional<List<CandidateDocument>> cached = cache.get(cacheKey);
                        if (cached.isPresent()) {
                            metrics.cacheHit();
                            recordSearch(searchId, rawQuery, domain, cached.get().size(), start, true);
                            return Mono.just(cached.get());
                        }
                    }

                    if (matchCount == 0) {
                        metrics.searchCompleted(true, clock.millis() - start);
                        recordSearch(searchId, rawQuery, domain, 0, start, false);
                        return Mono.just(List.<CandidateDocument>of());
                    }

                    SearchRequest request = SearchRequest.builder()
                            .query(queryEnhancer.enhance(rawQuery, domain))
                            .domain(domain)
                            .matchCount(matchCount)
                            .options(searchOptions)
                            .build();

                    return runStrategies(request)
                            .map(results -> ranker.aggregate(results, rawQuery, domain, matchCount))
                            .map(ranked -> config.isCacheEnabled() ? cache.put(cacheKey, ranked) : List.copyOf(ranked))
                            .doOnNext(ranked -> {
                                metrics.searchCompleted(true, clock.millis() - start);
                                recordSearch(searchId, rawQuery, domain, ranked.size(), start, false);
                            });
                })
                .onErrorResume(e -> {
                    log.error("Knowledge search failed for domain {}: {}", domain, e.getMessage(), e);
                    metrics.searchCompleted(false, clock.millis() - start);
                    return Mono.just(List.of());
                });
    }

    public Mono<List<CandidateDocument>> search(SearchRequest request) {
        Map<String, Object> options = new TreeMap<>(request.getOptions());
        options.put(OPTION_MATCH_COUNT, request.getMatchCount());
        return search(request.getQuery(), request.getDomain(), options);
    }

    /**
     * Digest of ranked results for delegated tasks.
     */
    public KnowledgeContext prepareContext(List<CandidateDocument> results, String taskType) {
        return contextBuilder.prepare(results, taskType);
    }

    /**
     * Clears cache, history and the retrieval counters.
     */
    public void reset() {
        cache.invalidateAll();
        history.clear();
        metrics.resetRetrieval();
        log.info("Knowledge retrieval state reset");
    }

    public long getCacheSize() {
        return cache.size();
    }

    public int getHistorySize() {
        return history.size();
    }

    public List<SearchRecord> getRecentSearches() {
        return history.recent();
    }

    public OrchestratorStatus.RetrievalStats getStats() {
        return metrics.retrievalStats();
    }

    private Mono<List<List<CandidateDocument>>> runStrategies(SearchRequest request) {
        Duration timeout = config.getStrategyTimeout();
        // flatMapSequential keeps strategy order for deduplication tie-breaks
        return Flux.fromIterable(strategies)
                .flatMapSequential(strategy -> Mono.defer(() -> strategy.search(request))
                        .timeout(timeout)
                        .onErrorResume(e -> {
                            log.warn("Search strategy {} failed: {}", strategy.getSource().getWireName(), e.getMessage());
                            return Mono.just(List.of());
                        })
                        .defaultIfEmpty(List.of()))
                .collectList();
    }

    private int resolveMatchCount(Map<String, Object> options) {
        Object value = options.get(OPTION_MATCH_COUNT);
        if (value instanceof Number) {
            return Math.max(0, ((Number) value).intValue());
        }
        return config.getDefaultMatchCount();
    }

    String cacheKey(String query, String domain, int matchCount, Map<String, Object> options) {
        Map<String, Object> keyOptions = new TreeMap<>(options);
        keyOptions.put(OPTION_MATCH_COUNT, matchCount);
        // JSON array keeps part boundaries intact whatever the parts contain
        List<Object> parts = Arrays.asList(query, domain, keyOptions);
        try {
            return keyMapper.writeValueAsString(parts);
        } catch (JsonProcessingException e) {
            return lengthPrefixed(query) + lengthPrefixed(domain) + lengthPrefixed(keyOptions.toString());
        }
    }

    private static String lengthPrefixed(String part) {
        return part == null ? "-1:" : part.length() + ":" + part;
    }

    private void recordSearch(String searchId, String query, String domain, int resultCount, long start, boolean cacheHit) {
        long elapsed = clock.millis() - start;
        history.record(SearchRecord.builder()
                .searchId(searchId)
                .query(query)
                .domain(domain)
                .resultCount(resultCount)
                .responseTimeMs(elapsed)
                .cacheHit(cacheHit)
                .timestamp(clock.instant())
                .build());
        structuredLogger.logKnowledgeSearch(searchId, domain, resultCount, elapsed, cacheHit);
    }
}
