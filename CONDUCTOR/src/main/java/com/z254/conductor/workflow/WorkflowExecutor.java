package com.z254.conductor.workflow;

import com.z254.conductor.domain.model.ExecutionContext;
import com.z254.conductor.domain.model.Phase;
import com.z254.conductor.domain.model.WorkflowPlan;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Executes a workflow plan phase by phase, strictly in plan order.
 * <p>
 * A failed non-critical phase is recorded and execution continues. A failed critical
 * phase ends the workflow with {@link CriticalPhaseFailureException}; later phases never run.
 * Without a task delegator every execution fails with {@link WorkflowConfigurationException}
 * before the first phase.
 */
@Slf4j
public class WorkflowExecutor {

    private final PhaseExecutor phaseExecutor;

    /**
     * @param phaseExecutor null when no task delegator is configured
     */
    public WorkflowExecutor(PhaseExecutor phaseExecutor) {
        this.phaseExecutor = phaseExecutor;
    }

    public boolean isConfigured() {
        return phaseExecutor != null;
    }

    public Mono<ExecutionContext> execute(WorkflowPlan plan) {
        String workflowId = plan.getPlanId() != null ? plan.getPlanId() : "wf_" + UUID.randomUUID();
        return execute(newContext(workflowId, plan));
    }

    /**
     * Creates a pending context stamped with this executor's clock.
     */
    public ExecutionContext newContext(String workflowId, WorkflowPlan plan) {
        Clock clock = phaseExecutor != null ? phaseExecutor.getClock() : Clock.systemUTC();
        return new ExecutionContext(workflowId, plan, clock);
    }

    public Mono<ExecutionContext> execute(ExecutionContext context) {
        return Mono.defer(() -> {
            if (phaseExecutor == null) {
                return Mono.error(new WorkflowConfigurationException(
                        "No task delegator configured; workflow " + context.getWorkflowId() + " cannot start"));
            }

            context.markRunning();
            List<Phase> phases = context.getPlan().getPhases();

            return Flux.range(0, phases.size())
                    .concatMap(index -> Mono.defer(() -> {
                        Phase phase = phases.get(index);
                        context.enterPhase(index);
                        return phaseExecutor.execute(phase, context)
                                .flatMap(result -> {
                                    context.recordPhaseResult(result);
                                    if (result.isSuccess()) {
                                        return Mono.just(result);
                                    }
                                    if (phase.isCritical()) {
                                        log.error("Critical phase {} failed in workflow {}: {}",
                                                phase.getName(), context.getWorkflowId(), result.getError());
                                        context.markFailed(phase.getName());
                                        return Mono.error(new CriticalPhaseFailureException(
                                                phase.getName(), result.getError(), context));
                                    }
                                    log.warn("Non-critical phase {} failed in workflow {} ({} tasks failed), continuing",
                                            phase.getName(), context.getWorkflowId(), result.getTasksFailed());
                                    return Mono.just(result);
                                });
                    }))
                    .then(Mono.fromCallable(() -> {
                        context.markCompleted();
                        return context;
                    }))
                    .doOnError(e -> {
                        if (!context.getState().isTerminal()) {
                            context.markFailed(currentPhaseName(context));
                        }
                    });
        });
    }

    private static String currentPhaseName(ExecutionContext context) {
        int index = context.getCurrentPhaseIndex();
        List<Phase> phases = context.getPlan().getPhases();
        return index >= 0 && index < phases.size() ? phases.get(index).getName() : null;
    }
}
