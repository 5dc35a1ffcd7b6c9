package com.z254.conductor.client.impl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.z254.conductor.config.ConductorProperties;
import com.z254.conductor.domain.model.ExecutionContext;
import com.z254.conductor.domain.model.TaskResult;
import com.z254.conductor.domain.model.WorkflowTask;
import com.z254.conductor.resilience.ExternalCallGuard;
import com.z254.conductor.workflow.TaskDelegator;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Delegates tasks to remote agents over HTTP.
 * Calls go through the external call guard; transport errors become failed task results.
 */
@Component
@ConditionalOnProperty(name = "conductor.delegation.mode", havingValue = "remote")
@Slf4j
public class WebClientTaskDelegator implements TaskDelegator {

    public static final String API_NAME = "agent-delegation";

    private final WebClient webClient;
    private final ConductorProperties.DelegationProperties config;
    private final ExternalCallGuard callGuard;

    public WebClientTaskDelegator(WebClient.Builder webClientBuilder,
                                  ConductorProperties conductorProperties,
                                  ExternalCallGuard callGuard) {
        this.config = conductorProperties.getDelegation();
        this.callGuard = callGuard;
        if (config.getBaseUrl() == null || config.getBaseUrl().isEmpty()) {
            throw new IllegalStateException("conductor.delegation.base-url is required when conductor.delegation.mode=remote");
        }
        this.webClient = webClientBuilder
                .baseUrl(config.getBaseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public Mono<TaskResult> delegate(WorkflowTask task, ExecutionContext context) {
        long start = System.currentTimeMillis();

        Map<String, Object> body = new HashMap<>();
        body.put("workflowId", context.getWorkflowId());
        body.put("task", task.getName());
        body.put("payload", task.getPayload());
        body.put("previousResults", context.getIntermediateResults());
        if (context.getKnowledgeContext() != null) {
            body.put("knowledge", context.getKnowledgeContext());
        }

        return callGuard.execute(API_NAME, config.getTimeout(), () -> webClient.post()
                        .uri(config.getDelegatePath(), task.getAgentType())
                        .bodyValue(body)
                        .retrieve()
                        .bodyToMono(AgentResponse.class))
                .map(response -> response.isSuccess()
                        ? TaskResult.success(task, response.getOutput(), System.currentTimeMillis() - start)
                        : TaskResult.failure(task, response.getError(), System.currentTimeMillis() - start))
                .onErrorResume(e -> {
                    log.error("Delegation of {} to {} failed: {}", task.getName(), task.getAgentType(), e.getMessage());
                    return Mono.just(TaskResult.failure(task, e.getMessage(), System.currentTimeMillis() - start));
                });
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class AgentResponse {
        private boolean success;
        private String output;
        private String error;
    }
}
