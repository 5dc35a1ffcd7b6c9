package com.z254.conductor.workflow;

import com.z254.conductor.domain.model.CandidateDocument;
import com.z254.conductor.domain.model.ContentRequest;
import com.z254.conductor.domain.model.WorkflowPlan;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Builds the phase plan for a content request.
 */
public interface WorkflowPlanner {

    /**
     * @param knowledge documents retrieved for the request, possibly empty
     */
    Mono<WorkflowPlan> plan(ContentRequest request, List<CandidateDocument> knowledge);
}
