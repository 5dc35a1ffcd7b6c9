package com.z254.conductor.retrieval.strategy;

import com.z254.conductor.client.KnowledgeQuery;
import com.z254.conductor.client.KnowledgeSourceClient;
import com.z254.conductor.domain.model.CandidateDocument;
import com.z254.conductor.domain.model.SearchRequest;
import com.z254.conductor.domain.model.SourceStrategy;
import com.z254.conductor.resilience.ExternalCallGuard;
import com.z254.conductor.retrieval.DomainSearchProfiles;
import com.z254.conductor.retrieval.SearchStrategy;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Technical and implementation examples. Requests half the match count, rounded up.
 */
@Component
@Order(2)
public class CodeExampleSearchStrategy implements SearchStrategy {

    public static final String API_NAME = "code-examples";

    private final KnowledgeSourceClient client;
    private final ExternalCallGuard callGuard;
    private final DomainSearchProfiles profiles;

    public CodeExampleSearchStrategy(KnowledgeSourceClient client, ExternalCallGuard callGuard,
                                     DomainSearchProfiles profiles) {
        this.client = client;
        this.callGuard = callGuard;
        this.profiles = profiles;
    }

    @Override
    public SourceStrategy getSource() {
        return SourceStrategy.CODE_EXAMPLES;
    }

    @Override
    public Mono<List<CandidateDocument>> search(SearchRequest request) {
        KnowledgeQuery query = KnowledgeQuery.builder()
                .query(request.getQuery())
                .domain(request.getDomain())
                .sourceFilter(profiles.sourceFilter(request.getDomain()))
                .matchCount((request.getMatchCount() + 1) / 2)
                .build();
        return callGuard.execute(API_NAME, () -> client.searchCodeExamples(query));
    }
}
