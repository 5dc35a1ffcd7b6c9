package com.z254.conductor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-request metrics reported with every content result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentMetrics {
    private long completionTimeMs;
    private int phasesExecuted;
    private long tasksCompleted;
    private long tasksFailed;
    private int knowledgeDocuments;
    private int iterations;
    private double qualityScore;
}
