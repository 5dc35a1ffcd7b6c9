package com.z254.conductor.workflow.impl;

import com.z254.conductor.config.ConductorProperties;
import com.z254.conductor.domain.model.ContentRequest;
import com.z254.conductor.domain.model.ExecutionContext;
import com.z254.conductor.domain.model.KnowledgeContext;
import com.z254.conductor.domain.model.TaskResult;
import com.z254.conductor.domain.model.WorkflowTask;
import com.z254.conductor.workflow.RefinementController;
import com.z254.conductor.workflow.TaskDelegator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Local stand-in for the agent fleet. Produces deterministic output per agent type.
 */
@Component
@ConditionalOnProperty(name = "conductor.delegation.mode", havingValue = "simulated", matchIfMissing = true)
@Slf4j
public class SimulatedTaskDelegator implements TaskDelegator {

    public static final String ATTR_REQUEST = "request";

    private final Duration latency;

    public SimulatedTaskDelegator(ConductorProperties conductorProperties) {
        this.latency = conductorProperties.getDelegation().getSimulatedLatency();
        log.warn("Task delegation running in simulated mode - no agents are contacted");
    }

    @Override
    public Mono<TaskResult> delegate(WorkflowTask task, ExecutionContext context) {
        Mono<TaskResult> result = Mono.fromCallable(() -> TaskResult.success(task, render(task, context), latency.toMillis()));
        return latency.isZero() ? result : Mono.delay(latency).then(result);
    }

    private String render(WorkflowTask task, ExecutionContext context) {
        String subject = context.getAttribute(ATTR_REQUEST, ContentRequest.class)
                .map(ContentRequest::getDescription)
                .orElse(context.getPlan().getContentType());

        StringBuilder output = new StringBuilder()
                .append("**").append(task.getAgentType()).append("** ")
                .append(describe(task.getAgentType()))
                .append(" for \"").append(subject).append("\".");

        KnowledgeContext knowledge = context.getKnowledgeContext();
        if (knowledge != null && knowledge.getTotalResults() > 0) {
            List<String> topics = knowledge.getBySource().values().stream()
                    .flatMap(digest -> digest.getKeyTopics().stream())
                    .distinct()
                    .limit(5)
                    .toList();
            output.append(" Grounded in ").append(knowledge.getTotalResults())
                    .append(" knowledge documents covering ").append(String.join(", ", topics)).append('.');
        }

        context.getLastIntermediateResult()
                .ifPresent(previous -> output.append(" Builds on ").append(previous.getTaskName()).append('.'));

        context.getAttribute(RefinementController.ATTR_ORIGINAL_CONTENT, String.class)
                .filter(original -> "nlp-generator".equals(task.getAgentType()))
                .ifPresent(original -> output.append("\n\n").append(original));

        return output.toString();
    }

    private static String describe(String agentType) {
        return switch (agentType) {
            case "research" -> "compiled the evidence base and best practices";
            case "test-generator", "psychometrician" -> "designed validated assessment items";
            case "architect", "curriculum-designer" -> "structured the program modules and progression";
            case "nlp-generator" -> "wrote the participant-facing content";
            case "technique-designer" -> "designed guided exercises and techniques";
            case "integrator" -> "aligned terminology and cross-references between modules";
            case "quality-guardian" -> "reviewed accuracy, safety and readability";
            default -> "contributed " + agentType + " expertise";
        };
    }
}
