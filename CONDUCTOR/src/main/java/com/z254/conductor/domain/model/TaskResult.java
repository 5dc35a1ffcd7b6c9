package com.z254.conductor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Outcome of one delegated task. Failures are values, not exceptions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskResult {

    private String taskName;
    private String agentType;
    private boolean success;
    private String output;
    private String error;
    private long durationMs;
    private Instant completedAt;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    public static TaskResult success(WorkflowTask task, String output, long durationMs) {
        return TaskResult.builder()
                .taskName(task.getName())
                .agentType(task.getAgentType())
                .success(true)
                .output(output)
                .durationMs(durationMs)
                .completedAt(Instant.now())
                .build();
    }

    public static TaskResult failure(WorkflowTask task, String error, long durationMs) {
        return TaskResult.builder()
                .taskName(task.getName())
                .agentType(task.getAgentType())
                .success(false)
                .error(error)
                .durationMs(durationMs)
                .completedAt(Instant.now())
                .build();
    }
}
