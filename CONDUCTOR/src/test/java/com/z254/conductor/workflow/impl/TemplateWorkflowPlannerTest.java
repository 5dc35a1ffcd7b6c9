package com.z254.conductor.workflow.impl;

import com.z254.conductor.config.ConductorProperties;
import com.z254.conductor.domain.model.CandidateDocument;
import com.z254.conductor.domain.model.ContentRequest;
import com.z254.conductor.domain.model.Phase;
import com.z254.conductor.domain.model.WorkflowPlan;
import com.z254.conductor.domain.model.WorkflowTask;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link TemplateWorkflowPlanner}.
 */
class TemplateWorkflowPlannerTest {

    private ConductorProperties properties;
    private TemplateWorkflowPlanner planner;

    @BeforeEach
    void setUp() {
        properties = new ConductorProperties();
        planner = new TemplateWorkflowPlanner(properties);
    }

    private static ContentRequest.ContentRequestBuilder request() {
        return ContentRequest.builder()
                .type("therapeutic-program")
                .description("Program for managing exam anxiety")
                .domain("health-psychology");
    }

    private static List<String> phaseNames(WorkflowPlan plan) {
        return plan.getPhases().stream().map(Phase::getName).toList();
    }

    @Nested
    @DisplayName("Templates")
    class TemplateTests {

        @Test
        @DisplayName("should build the therapeutic program template with checkpoints")
        void therapeuticProgram() {
            // When
            WorkflowPlan plan = planner.buildPlan(request().build(), List.of());

            // Then
            assertThat(phaseNames(plan)).containsExactly(
                    "research", "assessment", "quality-checkpoint-1", "architecture", "quality-checkpoint-2",
                    "content-generation", "quality-checkpoint-3", "integration", "quality-checkpoint-4", "validation");
            assertThat(plan.getComplexity()).isEqualTo(1);
            assertThat(plan.getTaskCount()).isEqualTo(11);
            assertThat(plan.getPlanId()).startsWith("wf_");
            assertThat(plan.getEstimatedDuration()).isEqualTo(Duration.ofSeconds(1350));
            assertThat(plan.getMetadata()).containsEntry("templateDuration", Duration.ofMinutes(30));
        }

        @Test
        @DisplayName("should keep multi-agent phases parallel and make single-agent phases sequential")
        void parallelism() {
            // Given
            properties.getWorkflow().setCheckpointsEnabled(false);

            // When
            WorkflowPlan plan = planner.buildPlan(request().build(), List.of());

            // Then
            Phase contentGeneration = plan.getPhases().stream()
                    .filter(p -> p.getName().equals("content-generation")).findFirst().orElseThrow();
            assertThat(contentGeneration.isParallel()).isTrue();
            assertThat(contentGeneration.getTasks()).extracting(WorkflowTask::getAgentType)
                    .containsExactly("nlp-generator", "technique-designer");
            assertThat(plan.getPhases()).filteredOn(p -> !p.getName().equals("content-generation"))
                    .noneMatch(Phase::isParallel);
        }

        @Test
        @DisplayName("should fall back to the default template for unknown types")
        void unknownTypeFallsBack() {
            properties.getWorkflow().setCheckpointsEnabled(false);

            WorkflowPlan plan = planner.buildPlan(request().type("podcast").build(), List.of());

            assertThat(plan.getContentType()).isEqualTo("podcast");
            assertThat(phaseNames(plan)).startsWith("research", "assessment", "architecture");
        }

        @Test
        @DisplayName("should emit the plan through the reactive API")
        void reactivePlan() {
            StepVerifier.create(planner.plan(request().type("assessment-tool").build(), null))
                    .assertNext(plan -> assertThat(phaseNames(plan)).contains("psychometric-design", "implementation"))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Rules")
    class RuleTests {

        @BeforeEach
        void disableCheckpoints() {
            properties.getWorkflow().setCheckpointsEnabled(false);
        }

        @Test
        @DisplayName("should add domain agents to every phase and domain phases at the end")
        void clinicalDomain() {
            // When
            WorkflowPlan plan = planner.buildPlan(request().domain("clinical-psychology").build(), List.of());

            // Then
            assertThat(plan.getPhases()).allSatisfy(phase -> assertThat(phase.getTasks())
                    .extracting(WorkflowTask::getAgentType)
                    .contains("clinical-expert", "ethics-reviewer"));
            assertThat(phaseNames(plan)).endsWith("ethical-review", "clinical-validation");
            assertThat(plan.getPhases().get(0).getTasks()).extracting(WorkflowTask::getName)
                    .containsExactly("research:research", "research:clinical-expert", "research:ethics-reviewer");
        }

        @Test
        @DisplayName("should insert audience adaptation before validation")
        void audienceAdaptation() {
            WorkflowPlan plan = planner.buildPlan(request().targetAudience("teenagers").build(), List.of());

            List<String> names = phaseNames(plan);
            assertThat(names.indexOf("audience-adaptation")).isEqualTo(names.indexOf("validation") - 1);
        }

        @Test
        @DisplayName("should append cultural and accessibility phases")
        void culturalAndAccessibility() {
            WorkflowPlan plan = planner.buildPlan(request()
                    .culturalContext("rural communities")
                    .accessibility(true)
                    .build(), List.of());

            assertThat(phaseNames(plan)).endsWith("cultural-adaptation", "accessibility-optimization");
            Phase cultural = plan.getPhases().get(plan.getPhases().size() - 2);
            assertThat(cultural.isCritical()).isTrue();
            assertThat(cultural.isParallel()).isFalse();
        }

        @Test
        @DisplayName("should add review phases for complex requests")
        void complexRequest() {
            // Given
            ContentRequest complex = request()
                    .type("comprehensive-program")
                    .objectives(List.of("a", "b", "c", "d"))
                    .description("x".repeat(1001))
                    .build();

            // When
            WorkflowPlan plan = planner.buildPlan(complex, List.of());

            // Then
            assertThat(plan.getComplexity()).isEqualTo(5);
            assertThat(phaseNames(plan)).contains("peer-review", "expert-consultation");
            assertThat(plan.getMetadata()).containsEntry("templateDuration", Duration.ofMinutes(150));
        }

        @Test
        @DisplayName("should attach relevant knowledge to research tasks")
        void knowledgeIntegration() {
            // Given
            List<CandidateDocument> knowledge = List.of(
                    CandidateDocument.builder().id("k1").rawRelevance(0.9).category("research").build(),
                    CandidateDocument.builder().id("k2").rawRelevance(0.6).category("research").build(),
                    CandidateDocument.builder().id("k3").rawRelevance(0.95).category("implementation").build());

            // When
            WorkflowPlan plan = planner.buildPlan(request().build(), knowledge);

            // Then
            Map<String, Object> payload = plan.getPhases().get(0).getTasks().get(0).getPayload();
            assertThat(payload.get("knowledgeDocumentIds")).isEqualTo(List.of("k1"));
            assertThat(payload.get("knowledgeQueries")).isEqualTo(List.of("methodology", "evidence-base", "best-practices"));
            assertThat(plan.getPhases().get(1).getTasks().get(0).getPayload()).doesNotContainKey("knowledgeQueries");
        }
    }

    @Test
    @DisplayName("should skip checkpoints for short plans and terminate")
    void checkpointsForShortPlans() {
        for (int size = 0; size <= 3; size++) {
            // Given
            List<TemplateWorkflowPlanner.PhaseSpec> phases = new ArrayList<>();
            for (int i = 0; i < size; i++) {
                phases.add(new TemplateWorkflowPlanner.PhaseSpec("step-" + i, false, true,
                        new ArrayList<>(List.of("research"))));
            }

            // When
            TemplateWorkflowPlanner.addQualityCheckpoints(phases);

            // Then
            assertThat(phases).hasSize(size);
        }
    }

    @Test
    @DisplayName("should insert checkpoints into a four-phase plan")
    void checkpointsForFourPhases() {
        List<TemplateWorkflowPlanner.PhaseSpec> phases = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            phases.add(new TemplateWorkflowPlanner.PhaseSpec("step-" + i, false, true,
                    new ArrayList<>(List.of("research"))));
        }

        TemplateWorkflowPlanner.addQualityCheckpoints(phases);

        assertThat(phases.stream().map(p -> p.toPhase().getName()))
                .containsExactly("step-0", "step-1", "quality-checkpoint-1", "step-2", "quality-checkpoint-2", "step-3");
    }

    @Test
    @DisplayName("should derive complexity from the request size")
    void assessComplexity() {
        assertThat(TemplateWorkflowPlanner.assessComplexity(ContentRequest.builder().build())).isEqualTo(1);
        assertThat(TemplateWorkflowPlanner.assessComplexity(ContentRequest.builder()
                .objectives(List.of("a", "b", "c", "d"))
                .parameters(Map.of("a", 1, "b", 2, "c", 3, "d", 4, "e", 5, "f", 6))
                .build())).isEqualTo(3);
        assertThat(TemplateWorkflowPlanner.assessComplexity(ContentRequest.builder()
                .type("comprehensive-program").build())).isEqualTo(3);
    }
}
