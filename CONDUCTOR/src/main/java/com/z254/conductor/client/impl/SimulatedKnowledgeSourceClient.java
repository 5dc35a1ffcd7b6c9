package com.z254.conductor.client.impl;

import com.z254.conductor.client.KnowledgeQuery;
import com.z254.conductor.client.KnowledgeSourceClient;
import com.z254.conductor.domain.model.CandidateDocument;
import com.z254.conductor.domain.model.SourceStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic knowledge source used when no remote source is configured.
 */
@Component
@ConditionalOnProperty(name = "conductor.source.mode", havingValue = "simulated", matchIfMissing = true)
@Slf4j
public class SimulatedKnowledgeSourceClient implements KnowledgeSourceClient {

    static final int MAX_KNOWLEDGE_RESULTS = 5;
    static final int MAX_CODE_RESULTS = 3;

    private final Clock clock;

    public SimulatedKnowledgeSourceClient(Clock clock) {
        this.clock = clock;
        log.warn("Knowledge source running in simulated mode - results are generated locally");
    }

    @Override
    public Mono<List<CandidateDocument>> searchKnowledgeBase(KnowledgeQuery query) {
        return Mono.fromSupplier(() -> {
            Instant now = clock.instant();
            int count = Math.min(query.getMatchCount(), MAX_KNOWLEDGE_RESULTS);
            List<CandidateDocument> results = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                results.add(CandidateDocument.builder()
                        .id("sim-kb-" + Integer.toHexString(query.getQuery().hashCode()) + "-" + i)
                        .title("Knowledge Base Result " + (i + 1) + " for \"" + query.getQuery() + "\"")
                        .content("This is a simulated knowledge base result for the query \"" + query.getQuery()
                                + "\" in the " + query.getDomain() + " domain. It stands in for psychological"
                                + " research, theories and evidence-based practices.")
                        .sourceStrategy(SourceStrategy.KNOWLEDGE_BASE)
                        .domain(query.getDomain())
                        .rawRelevance(round(0.8 - i * 0.1))
                        .category(query.getDomain())
                        .category("research")
                        .category("evidence-based")
                        .url("https://knowledge-base.example.com/doc-" + i)
                        .publishedAt(now.minus(Duration.ofDays(i)))
                        .retrievedAt(now)
                        .metadataEntry("searchType", "general-knowledge")
                        .build());
            }
            return results;
        });
    }

    @Override
    public Mono<List<CandidateDocument>> searchCodeExamples(KnowledgeQuery query) {
        return Mono.fromSupplier(() -> {
            Instant now = clock.instant();
            int count = Math.min(query.getMatchCount(), MAX_CODE_RESULTS);
            List<CandidateDocument> results = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                results.add(CandidateDocument.builder()
                        .id("sim-code-" + Integer.toHexString(query.getQuery().hashCode()) + "-" + i)
                        .title("Implementation Example " + (i + 1) + ": " + query.getQuery())
                        .content("Simulated implementation example for \"" + query.getQuery()
                                + "\" covering delivery formats, interactive exercises and progress tracking.")
                        .sourceStrategy(SourceStrategy.CODE_EXAMPLES)
                        .domain(query.getDomain())
                        .rawRelevance(round(0.7 - i * 0.1))
                        .category("implementation")
                        .category("technical")
                        .url("https://code-examples.example.com/example-" + i)
                        .publishedAt(now.minus(Duration.ofDays(i * 7L)))
                        .retrievedAt(now)
                        .metadataEntry("searchType", "technical-implementation")
                        .build());
            }
            return results;
        });
    }

    private static double round(double value) {
        return Math.round(value * 100) / 100.0;
    }
}
