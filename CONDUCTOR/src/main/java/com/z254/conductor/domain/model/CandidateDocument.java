package com.z254.conductor.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * A document returned by one retrieval strategy.
 * Immutable; ranking produces a copy carrying the composite {@code finalScore}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CandidateDocument {

    String id;
    String title;
    String content;
    SourceStrategy sourceStrategy;
    String domain;

    /**
     * Relevance reported by the source, in [0, 1]. May be null when the source reports none.
     */
    Double rawRelevance;

    @Singular
    Set<String> categories;

    String url;
    Instant publishedAt;
    Instant retrievedAt;

    @Singular("metadataEntry")
    Map<String, Object> metadata;

    @With
    Double finalScore;

    public boolean hasCategory(String category) {
        return categories != null && categories.contains(category);
    }
}
