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
 * General knowledge lookup.
 */
@Component
@Order(1)
public class KnowledgeBaseSearchStrategy implements SearchStrategy {

    public static final String API_NAME = "knowledge-base";

    private final KnowledgeSourceClient client;
    private final ExternalCallGuard callGuard;
    private final DomainSearchProfiles profiles;

    public KnowledgeBaseSearchStrategy(KnowledgeSourceClient client, ExternalCallGuard callGuard,
                                       DomainSearchProfiles profiles) {
        this.client = client;
        this.callGuard = callGuard;
        this.profiles = profiles;
    }

    @Override
    public SourceStrategy getSource() {
        return SourceStrategy.KNOWLEDGE_BASE;
    }

    @Override
    public Mono<List<CandidateDocument>> search(SearchRequest request) {
        KnowledgeQuery query = KnowledgeQuery.builder()
                .query(request.getQuery())
                .domain(request.getDomain())
                .sourceFilter(profiles.sourceFilter(request.getDomain()))
                .matchCount(request.getMatchCount())
                .build();
        return callGuard.execute(API_NAME, () -> client.searchKnowledgeBase(query));
    }
}
