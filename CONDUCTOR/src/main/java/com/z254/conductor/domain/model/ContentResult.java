package com.z254.conductor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Outcome of a content request. Always well formed; {@code success} tells callers which fields apply.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentResult {

    private String workflowId;
    private boolean success;
    private String content;
    private QualityReport quality;

    /**
     * False when the final quality score stayed below the threshold.
     */
    private boolean qualityGateMet;

    private boolean refined;
    private String error;

    /**
     * Phase name, {@code configuration} or {@code orchestration}.
     */
    private String failurePoint;

    private ContentMetrics metrics;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    public static ContentResult failure(String workflowId, String error, String failurePoint, ContentMetrics metrics) {
        return ContentResult.builder()
                .workflowId(workflowId)
                .success(false)
                .error(error)
                .failurePoint(failurePoint)
                .metrics(metrics)
                .build();
    }
}
