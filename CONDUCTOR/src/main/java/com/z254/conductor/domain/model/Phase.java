package com.z254.conductor.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Ordered group of tasks executed either concurrently or one after another.
 * A failed critical phase terminates the workflow.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Phase {

    String name;
    boolean parallel;
    boolean critical;

    @Singular
    List<WorkflowTask> tasks;
}
