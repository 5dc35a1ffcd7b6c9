package com.z254.conductor.workflow;

import com.z254.conductor.domain.model.ExecutionContext;
import com.z254.conductor.domain.model.QualityReport;
import com.z254.conductor.domain.model.RefinementOutcome;
import com.z254.conductor.domain.model.TaskResult;
import com.z254.conductor.domain.model.WorkflowTask;
import com.z254.conductor.observability.ConductorMetrics;
import com.z254.conductor.workflow.impl.FeedbackRefinementPlanSelector;
import com.z254.conductor.workflow.impl.SectionedContentIntegrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link RefinementController}.
 */
@ExtendWith(MockitoExtension.class)
class RefinementControllerTest {

    private static final double THRESHOLD = 0.8;

    @Mock
    private TaskDelegator delegator;

    @Mock
    private QualityScorer qualityScorer;

    @Spy
    private FeedbackRefinementPlanSelector planSelector;

    private ConductorMetrics metrics;
    private RefinementController controller;

    private final QualityReport lowQuality = QualityReport.builder()
            .score(0.6)
            .issues(List.of("Content is shorter than 200 characters"))
            .build();

    @BeforeEach
    void setUp() {
        metrics = WorkflowTestSupport.metrics();
        WorkflowExecutor executor = new WorkflowExecutor(new PhaseExecutor(delegator, WorkflowTestSupport.TASK_TIMEOUT,
                8, metrics, WorkflowTestSupport.structuredLogger()));
        controller = new RefinementController(planSelector, executor, new SectionedContentIntegrator(),
                qualityScorer, metrics, WorkflowTestSupport.structuredLogger());
    }

    private void delegateSucceeds() {
        when(delegator.delegate(any(), any())).thenAnswer(invocation -> {
            WorkflowTask task = invocation.getArgument(0);
            return Mono.just(TaskResult.success(task, "refined by " + task.getAgentType(), 1));
        });
    }

    @Test
    @DisplayName("should run exactly one refinement pass when the score improves")
    void singlePassImproves() {
        // Given
        delegateSucceeds();
        when(qualityScorer.score(anyString(), eq("clinical-psychology")))
                .thenReturn(Mono.just(QualityReport.builder().score(0.9).build()));

        // When / Then
        StepVerifier.create(controller.refine("wf_1", "clinical-psychology", "draft", lowQuality, THRESHOLD))
                .assertNext(outcome -> {
                    assertThat(outcome.isQualityGateMet()).isTrue();
                    assertThat(outcome.getRefinementType()).isEqualTo(FeedbackRefinementPlanSelector.CONTENT_QUALITY);
                    assertThat(outcome.getContent()).contains("## targeted-improvement");
                    assertThat(outcome.getTasksExecuted()).isEqualTo(4);
                })
                .verifyComplete();

        verify(planSelector, times(1)).select("wf_1", "clinical-psychology", lowQuality);
        verify(delegator, times(4)).delegate(any(), any());
        verify(qualityScorer, times(1)).score(anyString(), any());
        assertThat(metrics.getRefinements().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should flag content still below the threshold without a second pass")
    void flagsWhenStillLow() {
        // Given
        delegateSucceeds();
        when(qualityScorer.score(anyString(), any()))
                .thenReturn(Mono.just(QualityReport.builder().score(0.7).build()));

        // When
        RefinementOutcome outcome = controller.refine("wf_2", "clinical-psychology", "draft", lowQuality, THRESHOLD).block();

        // Then
        assertThat(outcome.isQualityGateMet()).isFalse();
        assertThat(outcome.getQuality().getScore()).isEqualTo(0.7);
        verify(planSelector, times(1)).select(any(), any(), any());
        verify(qualityScorer, times(1)).score(anyString(), any());
        assertThat(metrics.getQualityGateMisses().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should keep the original content when the refinement workflow aborts")
    void keepsOriginalOnAbort() {
        // Given
        when(delegator.delegate(any(), any())).thenAnswer(invocation ->
                Mono.just(TaskResult.failure(invocation.getArgument(0), "agent offline", 1)));

        // When / Then
        StepVerifier.create(controller.refine("wf_3", "clinical-psychology", "draft", lowQuality, THRESHOLD))
                .assertNext(outcome -> {
                    assertThat(outcome.getContent()).isEqualTo("draft");
                    assertThat(outcome.getQuality()).isSameAs(lowQuality);
                    assertThat(outcome.isQualityGateMet()).isFalse();
                    assertThat(outcome.getError()).contains("feedback-analysis");
                })
                .verifyComplete();

        // feedback-analysis is critical, so only its single task ran
        verify(delegator, times(1)).delegate(any(), any());
    }

    @Test
    @DisplayName("should expose the original content and feedback to refinement tasks")
    void passesOriginalContent() {
        // Given
        when(delegator.delegate(any(), any())).thenAnswer(invocation -> {
            WorkflowTask task = invocation.getArgument(0);
            ExecutionContext context = invocation.getArgument(1);
            String original = context.getAttribute(RefinementController.ATTR_ORIGINAL_CONTENT, String.class).orElse("");
            boolean hasFeedback = context.getAttribute(RefinementController.ATTR_QUALITY_FEEDBACK, QualityReport.class)
                    .isPresent();
            return Mono.just(TaskResult.success(task, original + "/" + hasFeedback, 1));
        });
        when(qualityScorer.score(anyString(), any())).thenReturn(Mono.just(QualityReport.builder().score(0.85).build()));

        // When
        RefinementOutcome outcome = controller.refine("wf_4", "health-psychology", "draft", lowQuality, THRESHOLD).block();

        // Then
        assertThat(outcome.getContent()).contains("draft/true");
    }
}
