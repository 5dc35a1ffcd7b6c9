package com.z254.conductor.workflow.impl;

import com.z254.conductor.domain.model.Phase;
import com.z254.conductor.domain.model.QualityReport;
import com.z254.conductor.domain.model.WorkflowPlan;
import com.z254.conductor.domain.model.WorkflowTask;
import com.z254.conductor.workflow.RefinementPlanSelector;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Selects refinement agents from keywords in the quality feedback.
 */
public class FeedbackRefinementPlanSelector implements RefinementPlanSelector {

    public static final String CONTENT_QUALITY = "content-quality";
    public static final String SCIENTIFIC_ACCURACY = "scientific-accuracy";
    public static final String USER_EXPERIENCE = "user-experience";
    public static final String COMPREHENSIVE = "comprehensive";

    static final Duration BASE_DURATION = Duration.ofMinutes(10);

    @Override
    public WorkflowPlan select(String workflowId, String domain, QualityReport feedback) {
        String refinementType = classify(feedback);

        List<String> improvementAgents = new ArrayList<>(List.of("nlp-generator"));
        switch (refinementType) {
            case CONTENT_QUALITY -> improvementAgents.add("content-editor");
            case SCIENTIFIC_ACCURACY -> improvementAgents.addAll(List.of("research-validator", "fact-checker"));
            case USER_EXPERIENCE -> improvementAgents.addAll(List.of("ux-specialist", "accessibility-expert"));
            default -> improvementAgents.addAll(List.of("content-editor", "research-validator", "ux-specialist"));
        }

        Duration estimated = COMPREHENSIVE.equals(refinementType)
                ? Duration.ofMillis((long) (BASE_DURATION.toMillis() * 1.5))
                : BASE_DURATION;

        return WorkflowPlan.builder()
                .planId(workflowId + "-refinement")
                .contentType("refinement")
                .domain(domain)
                .complexity(1)
                .estimatedDuration(estimated)
                .phase(phase("feedback-analysis", refinementType, List.of("quality-guardian")))
                .phase(phase("targeted-improvement", refinementType, improvementAgents))
                .phase(phase("revalidation", refinementType, List.of("quality-guardian")))
                .metadataEntry(METADATA_REFINEMENT_TYPE, refinementType)
                .build();
    }

    /**
     * First matching keyword group wins.
     */
    public String classify(QualityReport feedback) {
        if (feedback == null) {
            return COMPREHENSIVE;
        }
        StringBuilder text = new StringBuilder();
        feedback.getIssues().forEach(issue -> text.append(issue).append(' '));
        feedback.getRecommendations().forEach(recommendation -> text.append(recommendation).append(' '));
        feedback.getDimensionScores().keySet().forEach(dimension -> text.append(dimension).append(' '));
        String lower = text.toString().toLowerCase(Locale.ROOT);

        if (lower.contains("content") || lower.contains("clarity")) return CONTENT_QUALITY;
        if (lower.contains("research") || lower.contains("evidence")) return SCIENTIFIC_ACCURACY;
        if (lower.contains("user") || lower.contains("experience")) return USER_EXPERIENCE;
        return COMPREHENSIVE;
    }

    private static Phase phase(String name, String refinementType, List<String> agents) {
        Phase.PhaseBuilder builder = Phase.builder().name(name).parallel(false).critical(true);
        agents.forEach(agent -> builder.task(WorkflowTask.builder()
                .name(name + ":" + agent)
                .agentType(agent)
                .payloadEntry("phase", name)
                .payloadEntry(METADATA_REFINEMENT_TYPE, refinementType)
                .build()));
        return builder.build();
    }
}
