package com.z254.conductor.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Entry of the bounded search history.
 */
@Value
@Builder
public class SearchRecord {
    String searchId;
    String query;
    String domain;
    int resultCount;
    long responseTimeMs;
    boolean cacheHit;
    Instant timestamp;
}
