package com.z254.conductor.workflow;

import com.z254.conductor.domain.model.QualityReport;
import reactor.core.publisher.Mono;

/**
 * Scores integrated content in [0, 1] with structured feedback.
 */
public interface QualityScorer {

    Mono<QualityReport> score(String content, String domain);
}
