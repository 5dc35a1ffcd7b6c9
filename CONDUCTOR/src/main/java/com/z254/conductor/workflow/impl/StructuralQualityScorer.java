package com.z254.conductor.workflow.impl;

import com.z254.conductor.config.ConductorProperties;
import com.z254.conductor.domain.model.QualityReport;
import com.z254.conductor.workflow.QualityScorer;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores content by length and section coverage. Hosts replace it with a domain-aware scorer.
 */
public class StructuralQualityScorer implements QualityScorer {

    private final int minContentLength;
    private final int expectedSections;

    public StructuralQualityScorer(ConductorProperties.QualityProperties config) {
        this.minContentLength = Math.max(1, config.getMinContentLength());
        this.expectedSections = Math.max(1, config.getExpectedSections());
    }

    @Override
    public Mono<QualityReport> score(String content, String domain) {
        return Mono.fromCallable(() -> {
            String text = content != null ? content.trim() : "";
            long sections = text.lines().filter(line -> line.startsWith("## ")).count();

            double completeness = Math.min(1.0, (double) text.length() / minContentLength);
            double structure = Math.min(1.0, (double) sections / expectedSections);

            List<String> issues = new ArrayList<>();
            List<String> recommendations = new ArrayList<>();
            if (completeness < 1.0) {
                issues.add("Content is shorter than " + minContentLength + " characters");
                recommendations.add("Expand the content with examples and exercises");
            }
            if (structure < 1.0) {
                issues.add("Only " + sections + " of " + expectedSections + " expected sections present");
                recommendations.add("Add the missing sections");
            }

            Map<String, Double> dimensions = new LinkedHashMap<>();
            dimensions.put("completeness", completeness);
            dimensions.put("structure", structure);

            return QualityReport.builder()
                    .score((completeness + structure) / 2.0)
                    .issues(issues)
                    .recommendations(recommendations)
                    .dimensionScores(dimensions)
                    .build();
        });
    }
}
