package com.z254.conductor.retrieval.strategy;

import com.z254.conductor.client.KnowledgeQuery;
import com.z254.conductor.client.KnowledgeSourceClient;
import com.z254.conductor.config.ConductorProperties;
import com.z254.conductor.config.ConductorProperties.DomainProfile;
import com.z254.conductor.domain.model.CandidateDocument;
import com.z254.conductor.domain.model.SearchRequest;
import com.z254.conductor.domain.model.SourceStrategy;
import com.z254.conductor.resilience.ExternalCallGuard;
import com.z254.conductor.retrieval.DomainSearchProfiles;
import com.z254.conductor.retrieval.SearchStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Domain-specialized lookups: one knowledge base query per leading priority term
 * of the domain profile. Each lookup fails on its own; a domain without a profile yields nothing.
 */
@Component
@Order(3)
@Slf4j
public class SpecializedContentSearchStrategy implements SearchStrategy {

    private final KnowledgeSourceClient client;
    private final ExternalCallGuard callGuard;
    private final DomainSearchProfiles profiles;
    private final int termLimit;
    private final int matchCountPerTerm;

    public SpecializedContentSearchStrategy(KnowledgeSourceClient client, ExternalCallGuard callGuard,
                                            DomainSearchProfiles profiles, ConductorProperties conductorProperties) {
        this.client = client;
        this.callGuard = callGuard;
        this.profiles = profiles;
        this.termLimit = conductorProperties.getRetrieval().getSpecializedTermLimit();
        this.matchCountPerTerm = conductorProperties.getRetrieval().getSpecializedMatchCount();
    }

    @Override
    public SourceStrategy getSource() {
        return SourceStrategy.SPECIALIZED;
    }

    @Override
    public Mono<List<CandidateDocument>> search(SearchRequest request) {
        Optional<DomainProfile> profile = profiles.find(request.getDomain());
        if (profile.isEmpty()) {
            return Mono.just(List.of());
        }

        String sourceFilter = profiles.sourceFilter(request.getDomain());
        List<KnowledgeQuery> queries = profile.get().getPriorityTerms().stream()
                .limit(termLimit)
                .map(term -> KnowledgeQuery.builder()
                        .query(request.getQuery() + " " + term)
                        .domain(request.getDomain())
                        .sourceFilter(sourceFilter)
                        .matchCount(matchCountPerTerm)
                        .build())
                .collect(Collectors.toList());

        return Flux.fromIterable(queries)
                .flatMapSequential(query -> callGuard
                        .execute(KnowledgeBaseSearchStrategy.API_NAME, () -> client.searchKnowledgeBase(query))
                        .onErrorResume(e -> {
                            log.warn("Specialized lookup '{}' failed: {}", query.getQuery(), e.getMessage());
                            return Mono.just(List.of());
                        })
                        .defaultIfEmpty(List.of()))
                .flatMapIterable(results -> results)
                .map(document -> document.toBuilder().sourceStrategy(SourceStrategy.SPECIALIZED).build())
                .collectList();
    }
}
