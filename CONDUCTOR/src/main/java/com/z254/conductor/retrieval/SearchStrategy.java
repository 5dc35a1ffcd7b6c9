package com.z254.conductor.retrieval;

import com.z254.conductor.domain.model.CandidateDocument;
import com.z254.conductor.domain.model.SearchRequest;
import com.z254.conductor.domain.model.SourceStrategy;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * One independent retrieval method. Failures are signalled as errors;
 * the retrieval service turns them into empty results.
 */
public interface SearchStrategy {

    SourceStrategy getSource();

    /**
     * @param request search with the domain-enhanced query
     */
    Mono<List<CandidateDocument>> search(SearchRequest request);
}
