package com.z254.conductor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only snapshot of the orchestrator and its retrieval subsystem.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrchestratorStatus {

    private int activeWorkflows;
    private long totalProcessed;
    private double successRate;
    private double averageQuality;
    private double averageCompletionTimeMs;

    private long cacheSize;
    private int searchHistorySize;

    private RetrievalStats retrieval;
    private ExternalApiStats externalApi;

    @Builder.Default
    private Map<String, Double> averagePhaseDurationMs = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Object> config = new LinkedHashMap<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RetrievalStats {
        private long totalSearches;
        private long successfulSearches;
        private long cacheHits;
        private double averageResponseTimeMs;
        private double successRate;
        private double cacheHitRate;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ExternalApiStats {
        private long totalRequests;
        private long successfulRequests;
        private long failedRequests;
        private long rateLimitHits;
        private long timeoutCount;
        private int activeRequests;
        private double averageResponseTimeMs;
    }
}
