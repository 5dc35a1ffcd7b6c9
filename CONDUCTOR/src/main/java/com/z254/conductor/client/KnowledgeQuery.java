package com.z254.conductor.client;

import lombok.Builder;
import lombok.Value;

/**
 * Lookup sent to a knowledge source.
 */
@Value
@Builder(toBuilder = true)
public class KnowledgeQuery {

    String query;

    /**
     * Requested psychology domain, e.g. clinical-psychology.
     */
    String domain;

    /**
     * Source-side domain filter derived from {@link #domain}; null for no filter.
     */
    String sourceFilter;

    int matchCount;
}
