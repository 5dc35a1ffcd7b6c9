package com.z254.conductor.retrieval;

import com.z254.conductor.domain.model.CandidateDocument;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Merges strategy results into one ranked list: deduplicate, drop low relevance,
 * score, stable-sort and truncate.
 * Deterministic for identical input sequences and a fixed clock.
 */
@Slf4j
public class ResultRanker {

    static final double MISSING_RELEVANCE_FOR_FILTER = 1.0;

    private final double relevanceThreshold;
    private final Clock clock;

    public ResultRanker(double relevanceThreshold, Clock clock) {
        this.relevanceThreshold = relevanceThreshold;
        this.clock = clock;
    }

    /**
     * @param strategyResults one list per strategy, in strategy execution order
     */
    public List<CandidateDocument> aggregate(List<List<CandidateDocument>> strategyResults,
                                             String originalQuery, String domain, int matchCount) {
        if (matchCount <= 0) {
            return List.of();
        }

        Map<String, CandidateDocument> unique = new LinkedHashMap<>();
        for (List<CandidateDocument> results : strategyResults) {
            if (results == null) {
                continue;
            }
            for (CandidateDocument document : results) {
                CandidateDocument withDomain = document.getDomain() == null && domain != null
                        ? document.toBuilder().domain(domain).build()
                        : document;
                unique.putIfAbsent(ContentFingerprinter.fingerprint(withDomain), withDomain);
            }
        }

        List<String> queryTerms = queryTerms(originalQuery);
        Instant now = clock.instant();

        List<CandidateDocument> scored = new ArrayList<>();
        for (CandidateDocument document : unique.values()) {
            double relevance = document.getRawRelevance() != null
                    ? document.getRawRelevance()
                    : MISSING_RELEVANCE_FOR_FILTER;
            if (relevance < relevanceThreshold) {
                continue;
            }
            scored.add(document.withFinalScore(RelevanceScorer.score(document, queryTerms, domain, now)));
        }

        // List.sort is stable: equal scores keep discovery order
        scored.sort(Comparator.comparingDouble(CandidateDocument::getFinalScore).reversed());

        log.debug("Ranked {} candidates ({} unique, {} above threshold) for domain {}",
                strategyResults.stream().mapToInt(r -> r == null ? 0 : r.size()).sum(),
                unique.size(), scored.size(), domain);

        return scored.size() > matchCount ? List.copyOf(scored.subList(0, matchCount)) : List.copyOf(scored);
    }

    static List<String> queryTerms(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        return Arrays.stream(query.toLowerCase(Locale.ROOT).trim().split("\\s+"))
                .filter(term -> !term.isEmpty())
                .collect(Collectors.toList());
    }
}
