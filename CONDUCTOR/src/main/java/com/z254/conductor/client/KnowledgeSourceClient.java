package com.z254.conductor.client;

import com.z254.conductor.domain.model.CandidateDocument;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Client for the knowledge source backing retrieval.
 */
public interface KnowledgeSourceClient {

    /**
     * General knowledge lookup.
     */
    Mono<List<CandidateDocument>> searchKnowledgeBase(KnowledgeQuery query);

    /**
     * Technical and implementation examples lookup.
     */
    Mono<List<CandidateDocument>> searchCodeExamples(KnowledgeQuery query);
}
