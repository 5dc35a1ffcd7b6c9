package com.z254.conductor.orchestration;

import com.z254.conductor.config.ConductorProperties;
import com.z254.conductor.domain.model.CandidateDocument;
import com.z254.conductor.domain.model.ContentMetrics;
import com.z254.conductor.domain.model.ContentRequest;
import com.z254.conductor.domain.model.ContentResult;
import com.z254.conductor.domain.model.ExecutionContext;
import com.z254.conductor.domain.model.OrchestratorStatus;
import com.z254.conductor.domain.model.QualityReport;
import com.z254.conductor.domain.model.RefinementOutcome;
import com.z254.conductor.domain.model.WorkflowPlan;
import com.z254.conductor.observability.ConductorMetrics;
import com.z254.conductor.observability.StructuredLogger;
import com.z254.conductor.retrieval.KnowledgeRetrievalService;
import com.z254.conductor.workflow.ContentIntegrator;
import com.z254.conductor.workflow.CriticalPhaseFailureException;
import com.z254.conductor.workflow.QualityScorer;
import com.z254.conductor.workflow.RefinementController;
import com.z254.conductor.workflow.WorkflowConfigurationException;
import com.z254.conductor.workflow.WorkflowExecutor;
import com.z254.conductor.workflow.WorkflowPlanner;
import com.z254.conductor.workflow.impl.SimulatedTaskDelegator;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Implementation of ContentOrchestrator.
 * <p>
 * A content request is analyzed, enriched with one knowledge search, planned, executed
 * phase by phase, integrated and scored. Content below the quality threshold gets a
 * single refinement pass.
 */
@Slf4j
public class ContentOrchestratorImpl implements ContentOrchestrator {

    public static final String FAILURE_CONFIGURATION = "configuration";
    public static final String FAILURE_ORCHESTRATION = "orchestration";

    private final KnowledgeRetrievalService retrievalService;
    private final WorkflowPlanner planner;
    private final WorkflowExecutor workflowExecutor;
    private final ContentIntegrator contentIntegrator;
    private final QualityScorer qualityScorer;
    private final RefinementController refinementController;
    private final ConductorMetrics metrics;
    private final StructuredLogger structuredLogger;
    private final ConductorProperties conductorProperties;

    private final Map<String, ActiveWorkflow> activeWorkflows = new ConcurrentHashMap<>();

    public ContentOrchestratorImpl(KnowledgeRetrievalService retrievalService,
                                   WorkflowPlanner planner,
                                   WorkflowExecutor workflowExecutor,
                                   ContentIntegrator contentIntegrator,
                                   QualityScorer qualityScorer,
                                   RefinementController refinementController,
                                   ConductorMetrics metrics,
                                   StructuredLogger structuredLogger,
                                   ConductorProperties conductorProperties) {
        this.retrievalService = retrievalService;
        this.planner = planner;
        this.workflowExecutor = workflowExecutor;
        this.contentIntegrator = contentIntegrator;
        this.qualityScorer = qualityScorer;
        this.refinementController = refinementController;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.conductorProperties = conductorProperties;
    }

    // --------------------------------------------------------------------------------------------
    // Content
    // --------------------------------------------------------------------------------------------

    @Override
    public Mono<ContentResult> createContent(ContentRequest request) {
        return Mono.defer(() -> {
            String workflowId = "wf_" + UUID.randomUUID().toString().substring(0, 12);
            long start = System.currentTimeMillis();
            String domain = request.getDomain() != null
                    ? request.getDomain()
                    : conductorProperties.getWorkflow().getDefaultDomain();

            metrics.workflowStarted();
            activeWorkflows.put(workflowId, new ActiveWorkflow(request, Instant.now(), "analysis"));

            WorkflowRun run = new WorkflowRun(workflowId, request, domain, start);

            // Nothing can run without a delegator, skip the knowledge search
            Mono<List<CandidateDocument>> knowledgeSearch = workflowExecutor.isConfigured()
                    ? gatherKnowledge(run)
                    : Mono.error(new WorkflowConfigurationException("No task delegator configured"));

            return knowledgeSearch
                    .doOnNext(run::setKnowledge)
                    .flatMap(found -> planner.plan(request, found))
                    .flatMap(plan -> execute(run, plan))
                    .flatMap(context -> integrateAndScore(run, context))
                    .onErrorResume(e -> Mono.just(fail(run.getWorkflowId(), start, run.getContext(), e)))
                    .doOnNext(result -> metrics.workflowFinished(result.isSuccess(),
                            System.currentTimeMillis() - start,
                            result.getQuality() != null ? result.getQuality().getScore() : null))
                    .doFinally(signal -> activeWorkflows.remove(workflowId));
        });
    }

    private Mono<List<CandidateDocument>> gatherKnowledge(WorkflowRun run) {
        ContentRequest request = run.getRequest();
        if (!conductorProperties.getRetrieval().isEnabled() || request.getDescription() == null) {
            return Mono.just(List.of());
        }
        return retrievalService.search(request.getDescription(), run.getDomain())
                .doOnNext(found -> structuredLogger.withWorkflowContext(run.getWorkflowId(),
                        () -> log.info("Knowledge search found {} relevant documents", found.size())));
    }

    private Mono<ExecutionContext> execute(WorkflowRun run, WorkflowPlan plan) {
        updatePhase(run.getWorkflowId(), "execution");
        structuredLogger.logWorkflowStarted(run.getWorkflowId(), plan.getContentType(), plan.getDomain(), plan.getComplexity());

        ExecutionContext context = workflowExecutor.newContext(run.getWorkflowId(), plan);
        context.setKnowledgeContext(retrievalService.prepareContext(run.getKnowledge(), plan.getContentType()));
        context.putAttribute(SimulatedTaskDelegator.ATTR_REQUEST, run.getRequest());
        run.setContext(context);

        return workflowExecutor.execute(context);
    }

    private Mono<ContentResult> integrateAndScore(WorkflowRun run, ExecutionContext context) {
        updatePhase(run.getWorkflowId(), "integration");
        double threshold = conductorProperties.getWorkflow().getQualityThreshold();

        return contentIntegrator.merge(context.getResultsByPhase())
                .defaultIfEmpty("")
                .flatMap(content -> qualityScorer.score(content, run.getDomain())
                        .flatMap(report -> {
                            if (report.meets(threshold) || !conductorProperties.getWorkflow().isRefinementEnabled()) {
                                return Mono.just(success(run, context, content, report, report.meets(threshold), null));
                            }
                            updatePhase(run.getWorkflowId(), "refinement");
                            structuredLogger.withWorkflowContext(run.getWorkflowId(),
                                    () -> log.info("Quality score {} below threshold {}, refining",
                                            report.getScore(), threshold));
                            return refinementController
                                    .refine(run.getWorkflowId(), run.getDomain(), content, report, threshold)
                                    .map(outcome -> success(run, context, outcome.getContent(), outcome.getQuality(),
                                            outcome.isQualityGateMet(), outcome));
                        }));
    }

    private ContentResult success(WorkflowRun run, ExecutionContext context, String content, QualityReport quality,
                                  boolean qualityGateMet, RefinementOutcome refinement) {
        long elapsed = System.currentTimeMillis() - run.getStartedAt();
        WorkflowPlan plan = context.getPlan();

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("contentType", plan.getContentType());
        metadata.put("domain", plan.getDomain());
        metadata.put("complexity", plan.getComplexity());
        metadata.put("estimatedDuration", String.valueOf(plan.getEstimatedDuration()));
        metadata.put("createdAt", Instant.now().toString());
        if (refinement != null) {
            metadata.put("refinementType", refinement.getRefinementType());
            if (refinement.getError() != null) {
                metadata.put("refinementError", refinement.getError());
            }
        }

        structuredLogger.logWorkflowCompleted(run.getWorkflowId(), quality.getScore(), qualityGateMet,
                refinement != null, elapsed);

        return ContentResult.builder()
                .workflowId(run.getWorkflowId())
                .success(true)
                .content(content)
                .quality(quality)
                .qualityGateMet(qualityGateMet)
                .refined(refinement != null)
                .metrics(ContentMetrics.builder()
                        .completionTimeMs(elapsed)
                        .phasesExecuted(context.getResultsByPhase().size())
                        .tasksCompleted(context.getCompletedTaskCount())
                        .tasksFailed(context.getFailedTaskCount())
                        .knowledgeDocuments(run.getKnowledge().size())
                        .iterations(refinement != null ? 2 : 1)
                        .qualityScore(quality.getScore())
                        .build())
                .metadata(metadata)
                .build();
    }

    private ContentResult fail(String workflowId, long start, ExecutionContext context, Throwable error) {
        String failurePoint;
        if (error instanceof CriticalPhaseFailureException) {
            failurePoint = ((CriticalPhaseFailureException) error).getPhaseName();
        } else if (error instanceof WorkflowConfigurationException) {
            failurePoint = FAILURE_CONFIGURATION;
        } else {
            failurePoint = FAILURE_ORCHESTRATION;
            structuredLogger.withWorkflowContext(workflowId,
                    () -> log.error("Workflow {} failed unexpectedly", workflowId, error));
        }
        structuredLogger.logWorkflowFailed(workflowId, failurePoint, error.getMessage());

        ContentMetrics.ContentMetricsBuilder failureMetrics = ContentMetrics.builder()
                .completionTimeMs(System.currentTimeMillis() - start)
                .iterations(1);
        if (context != null) {
            failureMetrics.phasesExecuted(context.getResultsByPhase().size())
                    .tasksCompleted(context.getCompletedTaskCount())
                    .tasksFailed(context.getFailedTaskCount());
        }
        return ContentResult.failure(workflowId, error.getMessage(), failurePoint, failureMetrics.build());
    }

    private void updatePhase(String workflowId, String phase) {
        activeWorkflows.computeIfPresent(workflowId, (id, active) -> {
            active.setCurrentPhase(phase);
            return active;
        });
    }

    // --------------------------------------------------------------------------------------------
    // Knowledge
    // --------------------------------------------------------------------------------------------

    @Override
    public Mono<List<CandidateDocument>> searchRelevantKnowledge(String query, String domain, Map<String, Object> options) {
        return retrievalService.search(query, domain, options);
    }

    // --------------------------------------------------------------------------------------------
    // Status
    // --------------------------------------------------------------------------------------------

    @Override
    public OrchestratorStatus getStatus() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("qualityThreshold", conductorProperties.getWorkflow().getQualityThreshold());
        config.put("refinementEnabled", conductorProperties.getWorkflow().isRefinementEnabled());
        config.put("retrievalEnabled", conductorProperties.getRetrieval().isEnabled());
        config.put("cacheTtl", conductorProperties.getRetrieval().getCacheTtl().toString());
        config.put("delegationMode", conductorProperties.getDelegation().getMode().name().toLowerCase());
        config.put("sourceMode", conductorProperties.getSource().getMode().name().toLowerCase());

        return OrchestratorStatus.builder()
                .activeWorkflows(activeWorkflows.size())
                .totalProcessed(metrics.getWorkflowsProcessed())
                .successRate(metrics.getWorkflowSuccessRate())
                .averageQuality(metrics.getAverageQuality())
                .averageCompletionTimeMs(metrics.getAverageCompletionTimeMs())
                .cacheSize(retrievalService.getCacheSize())
                .searchHistorySize(retrievalService.getHistorySize())
                .retrieval(retrievalService.getStats())
                .externalApi(metrics.externalApiStats())
                .averagePhaseDurationMs(metrics.averagePhaseDurations())
                .config(config)
                .build();
    }

    public Map<String, ActiveWorkflow> getActiveWorkflows() {
        return Map.copyOf(activeWorkflows);
    }

    @Data
    @AllArgsConstructor
    public static class ActiveWorkflow {
        private ContentRequest request;
        private Instant startedAt;
        private volatile String currentPhase;
    }

    /**
     * Per-request state threaded through the reactive chain.
     */
    @Data
    private static class WorkflowRun {
        private final String workflowId;
        private final ContentRequest request;
        private final String domain;
        private final long startedAt;
        private List<CandidateDocument> knowledge = List.of();
        private ExecutionContext context;
    }
}
