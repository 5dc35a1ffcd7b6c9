package com.z254.conductor.api.dto;

import com.z254.conductor.retrieval.KnowledgeRetrievalService;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Request DTO for a knowledge search.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KnowledgeSearchRequest {

    @NotBlank(message = "Query is required")
    private String query;

    private String domain;

    @Min(value = 0, message = "Match count must not be negative")
    private Integer matchCount;

    /**
     * Only used by the context endpoint.
     */
    private String taskType;

    private Map<String, Object> options;

    public Map<String, Object> toOptions() {
        Map<String, Object> merged = options != null ? new HashMap<>(options) : new HashMap<>();
        if (matchCount != null) {
            merged.put(KnowledgeRetrievalService.OPTION_MATCH_COUNT, matchCount);
        }
        return merged;
    }
}
