package com.z254.conductor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of the single refinement pass.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RefinementOutcome {

    private String content;
    private QualityReport quality;
    private boolean qualityGateMet;
    private String refinementType;
    private long tasksExecuted;

    /**
     * Set when the refinement workflow itself aborted and the original content was kept.
     */
    private String error;
}
