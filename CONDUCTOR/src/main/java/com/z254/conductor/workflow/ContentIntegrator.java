package com.z254.conductor.workflow;

import com.z254.conductor.domain.model.PhaseResult;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Assembles phase outputs into one document.
 */
public interface ContentIntegrator {

    /**
     * @param phaseResults results keyed by phase name, in execution order
     */
    Mono<String> merge(Map<String, PhaseResult> phaseResults);
}
