package com.z254.conductor.health;

import com.z254.conductor.config.ConductorProperties;
import com.z254.conductor.domain.model.OrchestratorStatus;
import com.z254.conductor.orchestration.ContentOrchestrator;
import com.z254.conductor.workflow.WorkflowExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Health indicator for CONDUCTOR service.
 * Reports DOWN while no task delegator is configured, since no workflow can run.
 */
@Component
@Slf4j
public class ConductorHealthIndicator implements ReactiveHealthIndicator {

    private final WorkflowExecutor workflowExecutor;
    private final ContentOrchestrator orchestrator;
    private final ConductorProperties conductorProperties;

    public ConductorHealthIndicator(WorkflowExecutor workflowExecutor,
                                    ContentOrchestrator orchestrator,
                                    ConductorProperties conductorProperties) {
        this.workflowExecutor = workflowExecutor;
        this.orchestrator = orchestrator;
        this.conductorProperties = conductorProperties;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(() -> {
                    boolean delegatorUp = workflowExecutor.isConfigured();
                    OrchestratorStatus status = orchestrator.getStatus();

                    Health.Builder builder = delegatorUp ? Health.up() : Health.down();
                    builder.withDetail("taskDelegator", delegatorUp ? "UP" : "NOT_CONFIGURED");
                    builder.withDetail("delegationMode", conductorProperties.getDelegation().getMode().name().toLowerCase());
                    builder.withDetail("activeWorkflows", status.getActiveWorkflows());
                    builder.withDetail("totalProcessed", status.getTotalProcessed());
                    builder.withDetail("workflowSuccessRate", status.getSuccessRate());
                    builder.withDetail("retrievalSuccessRate",
                            status.getRetrieval() != null ? status.getRetrieval().getSuccessRate() : 0.0);
                    builder.withDetail("cacheSize", status.getCacheSize());
                    builder.withDetail("retrievalEnabled", conductorProperties.getRetrieval().isEnabled());
                    return builder.build();
                })
                .onErrorResume(e -> {
                    log.error("Health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }
}
