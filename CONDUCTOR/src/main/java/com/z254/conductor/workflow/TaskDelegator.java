package com.z254.conductor.workflow;

import com.z254.conductor.domain.model.ExecutionContext;
import com.z254.conductor.domain.model.TaskResult;
import com.z254.conductor.domain.model.WorkflowTask;
import reactor.core.publisher.Mono;

/**
 * Executes one task on a logical agent.
 * Implementations should report failures as {@link TaskResult#failure}; error signals are also tolerated.
 */
public interface TaskDelegator {

    Mono<TaskResult> delegate(WorkflowTask task, ExecutionContext context);
}
