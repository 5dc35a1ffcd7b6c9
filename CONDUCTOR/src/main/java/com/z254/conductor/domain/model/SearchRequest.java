package com.z254.conductor.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * One knowledge search. Built fresh per call.
 */
@Value
@Builder
public class SearchRequest {

    String query;
    String domain;
    int matchCount;

    @Singular
    Map<String, Object> options;
}
