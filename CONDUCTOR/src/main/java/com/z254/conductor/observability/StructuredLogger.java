package com.z254.conductor.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Structured logging utility for CONDUCTOR.
 * Provides consistent, machine-parseable log entries with workflow context.
 */
@Component
@Slf4j
public class StructuredLogger {

    private final ObjectMapper objectMapper;

    // MDC keys for context
    public static final String MDC_WORKFLOW_ID = "workflowId";
    public static final String MDC_PHASE = "phase";
    public static final String MDC_SEARCH_ID = "searchId";

    public StructuredLogger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Runs {@code action} with the workflow id in the MDC and restores the previous value
     * afterwards, on the same thread.
     */
    public void withWorkflowContext(String workflowId, Runnable action) {
        String previous = MDC.get(MDC_WORKFLOW_ID);
        if (workflowId != null) MDC.put(MDC_WORKFLOW_ID, workflowId);
        try {
            action.run();
        } finally {
            if (previous != null) {
                MDC.put(MDC_WORKFLOW_ID, previous);
            } else {
                MDC.remove(MDC_WORKFLOW_ID);
            }
        }
    }

    public void logWorkflowStarted(String workflowId, String contentType, String domain, int complexity) {
        logEvent("workflow_started", Map.of(
                "workflowId", workflowId,
                "contentType", String.valueOf(contentType),
                "domain", String.valueOf(domain),
                "complexity", complexity
        ));
    }

    public void logPhaseCompleted(String workflowId, String phase, boolean success,
                                  long tasksCompleted, long tasksFailed, long durationMs) {
        MDC.put(MDC_PHASE, phase);
        logEvent("phase_completed", Map.of(
                "workflowId", workflowId,
                "phase", phase,
                "success", success,
                "tasksCompleted", tasksCompleted,
                "tasksFailed", tasksFailed,
                "durationMs", durationMs
        ));
        MDC.remove(MDC_PHASE);
    }

    public void logWorkflowCompleted(String workflowId, double qualityScore, boolean qualityGateMet,
                                     boolean refined, long durationMs) {
        logEvent("workflow_completed", Map.of(
                "workflowId", workflowId,
                "qualityScore", qualityScore,
                "qualityGateMet", qualityGateMet,
                "refined", refined,
                "durationMs", durationMs
        ));
    }

    public void logWorkflowFailed(String workflowId, String failurePoint, String errorMessage) {
        Map<String, Object> data = new HashMap<>();
        data.put("workflowId", workflowId);
        data.put("failurePoint", failurePoint);
        data.put("errorMessage", errorMessage != null ? errorMessage : "Unknown error");
        logEvent("workflow_failed", data);
    }

    public void logRefinementTriggered(String workflowId, double score, double threshold, String refinementType) {
        logEvent("refinement_triggered", Map.of(
                "workflowId", workflowId,
                "score", score,
                "threshold", threshold,
                "refinementType", refinementType
        ));
    }

    public void logKnowledgeSearch(String searchId, String domain, int resultCount,
                                   long durationMs, boolean cacheHit) {
        MDC.put(MDC_SEARCH_ID, searchId);
        logEvent("knowledge_search_completed", Map.of(
                "searchId", searchId,
                "domain", String.valueOf(domain),
                "resultCount", resultCount,
                "durationMs", durationMs,
                "cacheHit", cacheHit
        ));
        MDC.remove(MDC_SEARCH_ID);
    }

    public void logRateLimitRejected(String apiName, long retryAfterMs) {
        logEvent("rate_limit_rejected", Map.of(
                "apiName", apiName,
                "retryAfterMs", retryAfterMs
        ));
    }

    private void logEvent(String eventType, Map<String, Object> data) {
        Map<String, Object> event = new HashMap<>(data);
        event.put("event", eventType);
        event.put("timestamp", Instant.now().toString());
        event.put("service", "conductor");

        String workflowId = MDC.get(MDC_WORKFLOW_ID);
        if (workflowId != null) event.putIfAbsent("workflowId", workflowId);

        try {
            String json = objectMapper.writeValueAsString(event);
            log.info(json);
        } catch (JsonProcessingException e) {
            log.info("event={} data={}", eventType, data);
        }
    }
}
