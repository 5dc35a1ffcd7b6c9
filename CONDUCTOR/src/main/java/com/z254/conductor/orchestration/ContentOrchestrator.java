package com.z254.conductor.orchestration;

import com.z254.conductor.domain.model.CandidateDocument;
import com.z254.conductor.domain.model.ContentRequest;
import com.z254.conductor.domain.model.ContentResult;
import com.z254.conductor.domain.model.OrchestratorStatus;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Core interface for content orchestration.
 * Provides the content workflow, standalone knowledge retrieval and status introspection.
 */
public interface ContentOrchestrator {

    // --------------------------------------------------------------------------------------------
    // Content
    // --------------------------------------------------------------------------------------------

    /**
     * Run the full content workflow for a request.
     *
     * @param request The content request
     * @return A well-formed result; expected failures are reported with {@code success=false}
     */
    Mono<ContentResult> createContent(ContentRequest request);

    // --------------------------------------------------------------------------------------------
    // Knowledge
    // --------------------------------------------------------------------------------------------

    /**
     * Search relevant knowledge, independent of any workflow.
     *
     * @param query   The search text
     * @param domain  The psychology domain
     * @param options Search options, e.g. {@code matchCount}
     * @return Ranked documents, empty when nothing relevant was found or the search failed
     */
    Mono<List<CandidateDocument>> searchRelevantKnowledge(String query, String domain, Map<String, Object> options);

    // --------------------------------------------------------------------------------------------
    // Status
    // --------------------------------------------------------------------------------------------

    /**
     * Read-only snapshot of workflows, cache and metrics.
     */
    OrchestratorStatus getStatus();
}
