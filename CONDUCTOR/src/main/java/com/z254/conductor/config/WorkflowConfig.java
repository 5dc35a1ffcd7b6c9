package com.z254.conductor.config;

import com.z254.conductor.observability.ConductorMetrics;
import com.z254.conductor.observability.StructuredLogger;
import com.z254.conductor.orchestration.ContentOrchestrator;
import com.z254.conductor.orchestration.ContentOrchestratorImpl;
import com.z254.conductor.retrieval.KnowledgeRetrievalService;
import com.z254.conductor.workflow.ContentIntegrator;
import com.z254.conductor.workflow.PhaseExecutor;
import com.z254.conductor.workflow.QualityScorer;
import com.z254.conductor.workflow.RefinementController;
import com.z254.conductor.workflow.RefinementPlanSelector;
import com.z254.conductor.workflow.TaskDelegator;
import com.z254.conductor.workflow.WorkflowExecutor;
import com.z254.conductor.workflow.WorkflowPlanner;
import com.z254.conductor.workflow.impl.FeedbackRefinementPlanSelector;
import com.z254.conductor.workflow.impl.SectionedContentIntegrator;
import com.z254.conductor.workflow.impl.StructuralQualityScorer;
import com.z254.conductor.workflow.impl.TemplateWorkflowPlanner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wiring for the workflow engine.
 * Planner, integrator, scorer and refinement plan selector fall back to the built-in
 * implementations unless the host application defines its own.
 */
@Configuration
@Slf4j
public class WorkflowConfig {

    // ==================== Collaborators ====================

    @Bean
    @ConditionalOnMissingBean
    public WorkflowPlanner workflowPlanner(ConductorProperties properties) {
        return new TemplateWorkflowPlanner(properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public ContentIntegrator contentIntegrator() {
        return new SectionedContentIntegrator();
    }

    @Bean
    @ConditionalOnMissingBean
    public QualityScorer qualityScorer(ConductorProperties properties) {
        return new StructuralQualityScorer(properties.getQuality());
    }

    @Bean
    @ConditionalOnMissingBean
    public RefinementPlanSelector refinementPlanSelector() {
        return new FeedbackRefinementPlanSelector();
    }

    // ==================== Execution ====================

    @Bean
    public WorkflowExecutor workflowExecutor(ObjectProvider<TaskDelegator> delegatorProvider,
                                             ConductorProperties properties,
                                             ConductorMetrics metrics,
                                             StructuredLogger structuredLogger,
                                             Clock clock) {
        TaskDelegator delegator = delegatorProvider.getIfAvailable();
        if (delegator == null) {
            log.warn("No task delegator available (conductor.delegation.mode={}); workflows will fail to start",
                    properties.getDelegation().getMode().name().toLowerCase());
            return new WorkflowExecutor(null);
        }
        ConductorProperties.WorkflowProperties config = properties.getWorkflow();
        return new WorkflowExecutor(new PhaseExecutor(delegator, config.getTaskTimeout(),
                config.getMaxParallelTasks(), metrics, structuredLogger, clock));
    }

    @Bean
    public RefinementController refinementController(RefinementPlanSelector refinementPlanSelector,
                                                     WorkflowExecutor workflowExecutor,
                                                     ContentIntegrator contentIntegrator,
                                                     QualityScorer qualityScorer,
                                                     ConductorMetrics metrics,
                                                     StructuredLogger structuredLogger) {
        return new RefinementController(refinementPlanSelector, workflowExecutor, contentIntegrator,
                qualityScorer, metrics, structuredLogger);
    }

    @Bean
    public ContentOrchestrator contentOrchestrator(KnowledgeRetrievalService knowledgeRetrievalService,
                                                   WorkflowPlanner workflowPlanner,
                                                   WorkflowExecutor workflowExecutor,
                                                   ContentIntegrator contentIntegrator,
                                                   QualityScorer qualityScorer,
                                                   RefinementController refinementController,
                                                   ConductorMetrics metrics,
                                                   StructuredLogger structuredLogger,
                                                   ConductorProperties properties) {
        return new ContentOrchestratorImpl(knowledgeRetrievalService, workflowPlanner, workflowExecutor,
                contentIntegrator, qualityScorer, refinementController, metrics, structuredLogger, properties);
    }
}
