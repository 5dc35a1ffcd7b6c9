package com.z254.conductor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of one phase. {@code taskResults} follows the declared task order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PhaseResult {

    private String phaseName;
    private boolean success;

    @Builder.Default
    private List<TaskResult> taskResults = new ArrayList<>();

    private long durationMs;
    private String error;

    public long getTasksCompleted() {
        return taskResults.stream().filter(TaskResult::isSuccess).count();
    }

    public long getTasksFailed() {
        return taskResults.stream().filter(r -> !r.isSuccess()).count();
    }
}
