package com.z254.conductor.retrieval;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.z254.conductor.domain.model.CandidateDocument;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Time-bounded cache of ranked search results.
 * <p>
 * Entries expire {@code ttl} after being written and are never served afterwards.
 * Total entries are bounded by size-based eviction. Values are immutable snapshots.
 */
@Slf4j
public class RetrievalCache {

    private final Cache<String, List<CandidateDocument>> cache;

    public RetrievalCache(Duration ttl, long maxEntries) {
        this(ttl, maxEntries, Ticker.systemTicker());
    }

    public RetrievalCache(Duration ttl, long maxEntries, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxEntries)
                .ticker(ticker)
                .recordStats()
                .build();
        log.info("Initialized retrieval cache with TTL: {}, max size: {}", ttl, maxEntries);
    }

    public Optional<List<CandidateDocument>> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    /**
     * Stores an immutable copy of the results and returns it.
     */
    public List<CandidateDocument> put(String key, List<CandidateDocument> results) {
        List<CandidateDocument> snapshot = List.copyOf(results);
        cache.put(key, snapshot);
        return snapshot;
    }

    public void invalidateAll() {
        cache.invalidateAll();
        log.info("Retrieval cache cleared");
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public CacheStats getStats() {
        return cache.stats();
    }
}
