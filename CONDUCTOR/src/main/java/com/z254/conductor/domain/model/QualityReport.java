package com.z254.conductor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Score in [0, 1] plus structured feedback from a quality scorer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QualityReport {

    private double score;

    @Builder.Default
    private List<String> issues = new ArrayList<>();

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    @Builder.Default
    private Map<String, Double> dimensionScores = new LinkedHashMap<>();

    public boolean meets(double threshold) {
        return score >= threshold;
    }
}
