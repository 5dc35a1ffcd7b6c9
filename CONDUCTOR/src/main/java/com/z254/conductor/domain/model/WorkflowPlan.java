package com.z254.conductor.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Read-only sequence of phases produced by a planner.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class WorkflowPlan {

    String planId;
    String contentType;
    String domain;
    int complexity;
    Duration estimatedDuration;

    @Singular
    List<Phase> phases;

    @Singular("metadataEntry")
    Map<String, Object> metadata;

    public int getTaskCount() {
        return phases.stream().mapToInt(p -> p.getTasks().size()).sum();
    }
}
