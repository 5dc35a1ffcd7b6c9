package com.z254.conductor.domain.model;

import lombok.Getter;
import lombok.Setter;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mutable state of one in-flight workflow.
 * Only the executor that owns it records phases and moves its state;
 * delegated tasks read it.
 */
@Getter
public class ExecutionContext {

    private final String workflowId;
    private final WorkflowPlan plan;
    private final Instant startedAt;
    private final Map<String, PhaseResult> resultsByPhase = new LinkedHashMap<>();
    private final List<TaskResult> intermediateResults = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, Object> attributes = new ConcurrentHashMap<>();

    private volatile WorkflowState state = WorkflowState.PENDING;
    private volatile int currentPhaseIndex = -1;
    private volatile String failedPhase;

    @Setter
    private volatile KnowledgeContext knowledgeContext;

    public ExecutionContext(String workflowId, WorkflowPlan plan) {
        this(workflowId, plan, Clock.systemUTC());
    }

    public ExecutionContext(String workflowId, WorkflowPlan plan, Clock clock) {
        this.workflowId = workflowId;
        this.plan = plan;
        this.startedAt = clock.instant();
    }

    public void markRunning() {
        if (state != WorkflowState.PENDING) {
            throw new IllegalStateException("Workflow " + workflowId + " cannot start from state " + state);
        }
        state = WorkflowState.RUNNING;
    }

    public void enterPhase(int index) {
        requireRunning();
        currentPhaseIndex = index;
    }

    public synchronized void recordPhaseResult(PhaseResult result) {
        requireRunning();
        resultsByPhase.put(result.getPhaseName(), result);
    }

    public void markCompleted() {
        requireRunning();
        state = WorkflowState.COMPLETED;
    }

    public void markFailed(String phaseName) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Workflow " + workflowId + " already " + state);
        }
        failedPhase = phaseName;
        state = WorkflowState.FAILED;
    }

    /**
     * Clears the outputs passed between tasks of a sequential phase.
     */
    public void resetIntermediateResults() {
        intermediateResults.clear();
    }

    public void addIntermediateResult(TaskResult result) {
        intermediateResults.add(result);
    }

    public synchronized Map<String, PhaseResult> getResultsByPhase() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(resultsByPhase));
    }

    public List<TaskResult> getIntermediateResults() {
        synchronized (intermediateResults) {
            return List.copyOf(intermediateResults);
        }
    }

    public Optional<TaskResult> getLastIntermediateResult() {
        synchronized (intermediateResults) {
            return intermediateResults.isEmpty()
                    ? Optional.empty()
                    : Optional.of(intermediateResults.get(intermediateResults.size() - 1));
        }
    }

    public long getFailedTaskCount() {
        return getResultsByPhase().values().stream().mapToLong(PhaseResult::getTasksFailed).sum();
    }

    public long getCompletedTaskCount() {
        return getResultsByPhase().values().stream().mapToLong(PhaseResult::getTasksCompleted).sum();
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<T> getAttribute(String key, Class<T> type) {
        Object value = attributes.get(key);
        return type.isInstance(value) ? Optional.of((T) value) : Optional.empty();
    }

    public void putAttribute(String key, Object value) {
        attributes.put(key, value);
    }

    private void requireRunning() {
        if (state != WorkflowState.RUNNING) {
            throw new IllegalStateException("Workflow " + workflowId + " is not running (state " + state + ")");
        }
    }
}
