package com.z254.conductor.workflow.impl;

import com.z254.conductor.domain.model.Phase;
import com.z254.conductor.domain.model.QualityReport;
import com.z254.conductor.domain.model.WorkflowPlan;
import com.z254.conductor.domain.model.WorkflowTask;
import com.z254.conductor.workflow.RefinementPlanSelector;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link FeedbackRefinementPlanSelector}.
 */
class FeedbackRefinementPlanSelectorTest {

    private final FeedbackRefinementPlanSelector selector = new FeedbackRefinementPlanSelector();

    private static QualityReport report(String... issues) {
        return QualityReport.builder().score(0.5).issues(List.of(issues)).build();
    }

    @Test
    void classifiesByFirstMatchingKeywordGroup() {
        assertThat(selector.classify(report("Clarity of instructions is low"))).isEqualTo(FeedbackRefinementPlanSelector.CONTENT_QUALITY);
        assertThat(selector.classify(report("Weak evidence for claims"))).isEqualTo(FeedbackRefinementPlanSelector.SCIENTIFIC_ACCURACY);
        assertThat(selector.classify(report("Poor user journey"))).isEqualTo(FeedbackRefinementPlanSelector.USER_EXPERIENCE);
        assertThat(selector.classify(report("Tone is inconsistent"))).isEqualTo(FeedbackRefinementPlanSelector.COMPREHENSIVE);
        assertThat(selector.classify(null)).isEqualTo(FeedbackRefinementPlanSelector.COMPREHENSIVE);
    }

    @Test
    void buildsThreeSequentialCriticalPhases() {
        WorkflowPlan plan = selector.select("wf_9", "clinical-psychology", report("Weak research base"));

        assertThat(plan.getPlanId()).isEqualTo("wf_9-refinement");
        assertThat(plan.getPhases()).extracting(Phase::getName)
                .containsExactly("feedback-analysis", "targeted-improvement", "revalidation");
        assertThat(plan.getPhases()).allMatch(p -> p.isCritical() && !p.isParallel());
        assertThat(plan.getPhases().get(1).getTasks()).extracting(WorkflowTask::getAgentType)
                .containsExactly("nlp-generator", "research-validator", "fact-checker");
        assertThat(plan.getMetadata()).containsEntry(RefinementPlanSelector.METADATA_REFINEMENT_TYPE,
                FeedbackRefinementPlanSelector.SCIENTIFIC_ACCURACY);
        assertThat(plan.getEstimatedDuration()).isEqualTo(Duration.ofMinutes(10));
    }

    @Test
    void comprehensiveRefinementTakesLonger() {
        WorkflowPlan plan = selector.select("wf_9", "clinical-psychology", report("Tone is inconsistent"));

        assertThat(plan.getPhases().get(1).getTasks()).hasSize(4);
        assertThat(plan.getEstimatedDuration()).isEqualTo(Duration.ofMinutes(15));
    }
}
