package com.z254.conductor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Digest of retrieved documents handed to delegated tasks.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KnowledgeContext {

    private String taskType;
    private int totalResults;

    @Builder.Default
    private List<SourceStrategy> sources = new ArrayList<>();

    private double minRelevance;
    private double maxRelevance;

    @Builder.Default
    private Map<SourceStrategy, SourceDigest> bySource = new LinkedHashMap<>();

    public static KnowledgeContext empty(String taskType) {
        return KnowledgeContext.builder().taskType(taskType).build();
    }

    /**
     * Per-source summary of the retrieved documents.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SourceDigest {
        private int count;

        @Builder.Default
        private List<CandidateDocument> topResults = new ArrayList<>();

        private String summary;

        @Builder.Default
        private List<String> keyTopics = new ArrayList<>();
    }
}
