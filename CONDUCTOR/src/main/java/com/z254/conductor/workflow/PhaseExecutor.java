package com.z254.conductor.workflow;

import com.z254.conductor.domain.model.ExecutionContext;
import com.z254.conductor.domain.model.Phase;
import com.z254.conductor.domain.model.PhaseResult;
import com.z254.conductor.domain.model.TaskResult;
import com.z254.conductor.domain.model.WorkflowTask;
import com.z254.conductor.observability.ConductorMetrics;
import com.z254.conductor.observability.StructuredLogger;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Runs the tasks of one phase.
 * <p>
 * Parallel phases dispatch every task concurrently and wait for all of them;
 * a failed task never cancels its siblings. Sequential phases run tasks in declared
 * order, publishing each result to the context before the next task starts.
 * In both cases {@code taskResults} follows the declared task order.
 * A phase succeeds only when every task succeeds.
 */
@Slf4j
public class PhaseExecutor {

    private final TaskDelegator delegator;
    private final Duration taskTimeout;
    private final int maxParallelTasks;
    private final ConductorMetrics metrics;
    private final StructuredLogger structuredLogger;
    private final Clock clock;

    public PhaseExecutor(TaskDelegator delegator, Duration taskTimeout, int maxParallelTasks,
                         ConductorMetrics metrics, StructuredLogger structuredLogger) {
        this(delegator, taskTimeout, maxParallelTasks, metrics, structuredLogger, Clock.systemUTC());
    }

    public PhaseExecutor(TaskDelegator delegator, Duration taskTimeout, int maxParallelTasks,
                         ConductorMetrics metrics, StructuredLogger structuredLogger, Clock clock) {
        this.delegator = delegator;
        this.taskTimeout = taskTimeout;
        this.maxParallelTasks = Math.max(1, maxParallelTasks);
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    Clock getClock() {
        return clock;
    }

    public Mono<PhaseResult> execute(Phase phase, ExecutionContext context) {
        return Mono.defer(() -> {
            long start = clock.millis();
            log.debug("Executing phase {} ({} tasks, parallel={}) for workflow {}",
                    phase.getName(), phase.getTasks().size(), phase.isParallel(), context.getWorkflowId());

            Mono<List<TaskResult>> results = phase.isParallel()
                    ? runParallel(phase, context)
                    : runSequential(phase, context);

            return results.map(taskResults -> toPhaseResult(phase, taskResults, clock.millis() - start))
                    .doOnNext(result -> {
                        metrics.recordPhase(phase.getName(), result.getDurationMs(), result.isSuccess());
                        structuredLogger.logPhaseCompleted(context.getWorkflowId(), phase.getName(), result.isSuccess(),
                                result.getTasksCompleted(), result.getTasksFailed(), result.getDurationMs());
                    });
        });
    }

    private Mono<List<TaskResult>> runParallel(Phase phase, ExecutionContext context) {
        // flatMapSequential subscribes eagerly but emits in source order
        return Flux.fromIterable(phase.getTasks())
                .flatMapSequential(task -> delegate(task, context), maxParallelTasks)
                .collectList();
    }

    private Mono<List<TaskResult>> runSequential(Phase phase, ExecutionContext context) {
        return Mono.fromRunnable(context::resetIntermediateResults)
                .thenMany(Flux.fromIterable(phase.getTasks())
                        .concatMap(task -> delegate(task, context)
                                .doOnNext(context::addIntermediateResult)))
                .collectList();
    }

    Mono<TaskResult> delegate(WorkflowTask task, ExecutionContext context) {
        return Mono.defer(() -> {
            long start = clock.millis();
            return Mono.defer(() -> delegator.delegate(task, context))
                    .timeout(taskTimeout)
                    .switchIfEmpty(Mono.fromSupplier(() -> TaskResult.failure(task,
                            "Delegate returned no result", clock.millis() - start)))
                    .onErrorResume(e -> {
                        String message = e instanceof TimeoutException
                                ? "Task timed out after " + taskTimeout.toMillis() + "ms"
                                : String.valueOf(e.getMessage());
                        log.warn("Task {} of workflow {} failed: {}", task.getName(), context.getWorkflowId(), message);
                        return Mono.just(TaskResult.failure(task, message, clock.millis() - start));
                    });
        });
    }

    private PhaseResult toPhaseResult(Phase phase, List<TaskResult> taskResults, long durationMs) {
        List<TaskResult> failed = taskResults.stream().filter(r -> !r.isSuccess()).toList();
        String error = failed.isEmpty()
                ? null
                : failed.size() + " of " + taskResults.size() + " tasks failed: "
                        + failed.get(0).getTaskName() + " - " + failed.get(0).getError();
        return PhaseResult.builder()
                .phaseName(phase.getName())
                .success(failed.isEmpty())
                .taskResults(List.copyOf(taskResults))
                .durationMs(durationMs)
                .error(error)
                .build();
    }
}
