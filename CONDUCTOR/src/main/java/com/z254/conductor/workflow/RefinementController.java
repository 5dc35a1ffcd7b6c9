package com.z254.conductor.workflow;

import com.z254.conductor.domain.model.ExecutionContext;
import com.z254.conductor.domain.model.QualityReport;
import com.z254.conductor.domain.model.RefinementOutcome;
import com.z254.conductor.domain.model.WorkflowPlan;
import com.z254.conductor.observability.ConductorMetrics;
import com.z254.conductor.observability.StructuredLogger;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Runs the single refinement pass for content that missed the quality threshold.
 * <p>
 * The reduced plan runs once, its output is re-integrated and re-scored. Content still
 * below the threshold is returned flagged; it is never refined again.
 */
@Slf4j
public class RefinementController {

    public static final String ATTR_ORIGINAL_CONTENT = "originalContent";
    public static final String ATTR_QUALITY_FEEDBACK = "qualityFeedback";

    private final RefinementPlanSelector planSelector;
    private final WorkflowExecutor workflowExecutor;
    private final ContentIntegrator contentIntegrator;
    private final QualityScorer qualityScorer;
    private final ConductorMetrics metrics;
    private final StructuredLogger structuredLogger;

    public RefinementController(RefinementPlanSelector planSelector,
                                WorkflowExecutor workflowExecutor,
                                ContentIntegrator contentIntegrator,
                                QualityScorer qualityScorer,
                                ConductorMetrics metrics,
                                StructuredLogger structuredLogger) {
        this.planSelector = planSelector;
        this.workflowExecutor = workflowExecutor;
        this.contentIntegrator = contentIntegrator;
        this.qualityScorer = qualityScorer;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
    }

    public Mono<RefinementOutcome> refine(String workflowId, String domain, String content,
                                          QualityReport feedback, double thresholdScore) {
        return Mono.defer(() -> {
            WorkflowPlan plan = planSelector.select(workflowId, domain, feedback);
            String refinementType = String.valueOf(plan.getMetadata().get(RefinementPlanSelector.METADATA_REFINEMENT_TYPE));

            metrics.refinementTriggered();
            structuredLogger.logRefinementTriggered(workflowId, feedback.getScore(), thresholdScore, refinementType);

            ExecutionContext context = workflowExecutor.newContext(plan.getPlanId(), plan);
            context.putAttribute(ATTR_ORIGINAL_CONTENT, content);
            context.putAttribute(ATTR_QUALITY_FEEDBACK, feedback);

            return workflowExecutor.execute(context)
                    .flatMap(executed -> contentIntegrator.merge(executed.getResultsByPhase())
                            .defaultIfEmpty("")
                            .map(merged -> merged.isBlank() ? content : merged)
                            .flatMap(refined -> qualityScorer.score(refined, domain)
                                    .map(report -> RefinementOutcome.builder()
                                            .content(refined)
                                            .quality(report)
                                            .qualityGateMet(report.meets(thresholdScore))
                                            .refinementType(refinementType)
                                            .tasksExecuted(executed.getCompletedTaskCount() + executed.getFailedTaskCount())
                                            .build())))
                    .onErrorResume(e -> {
                        log.warn("Refinement of workflow {} aborted, keeping original content: {}",
                                workflowId, e.getMessage());
                        return Mono.just(RefinementOutcome.builder()
                                .content(content)
                                .quality(feedback)
                                .qualityGateMet(false)
                                .refinementType(refinementType)
                                .error(e.getMessage())
                                .build());
                    })
                    .doOnNext(outcome -> {
                        if (!outcome.isQualityGateMet()) {
                            metrics.qualityGateMissed();
                            log.info("Workflow {} still below quality threshold {} after refinement (score {})",
                                    workflowId, thresholdScore, outcome.getQuality().getScore());
                        }
                    });
        });
    }
}
