package com.z254.conductor.retrieval;

import com.z254.conductor.domain.model.CandidateDocument;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Composite relevance score of a candidate document, clamped to 1.0.
 */
public final class RelevanceScorer {

    static final double RELEVANCE_WEIGHT = 0.4;
    static final double DEFAULT_RELEVANCE = 0.5;
    static final double DEFAULT_SOURCE_WEIGHT = 0.2;
    static final double DOMAIN_BONUS = 0.2;
    static final double TERM_WEIGHT = 0.1;
    static final double RECENCY_WEIGHT = 0.05;
    static final double RECENCY_HORIZON_MONTHS = 24.0;
    static final long MILLIS_PER_MONTH = Duration.ofDays(30).toMillis();

    private RelevanceScorer() {
    }

    public static double score(CandidateDocument document, List<String> queryTerms, String domain, Instant now) {
        double relevance = document.getRawRelevance() != null ? document.getRawRelevance() : DEFAULT_RELEVANCE;
        double score = RELEVANCE_WEIGHT * relevance;

        score += document.getSourceStrategy() != null
                ? document.getSourceStrategy().getScoreWeight()
                : DEFAULT_SOURCE_WEIGHT;

        if (domain != null && (domain.equals(document.getDomain()) || document.hasCategory(domain))) {
            score += DOMAIN_BONUS;
        }

        score += TERM_WEIGHT * termCoverage(document, queryTerms);
        score += recencyBonus(document.getPublishedAt(), now);

        return Math.min(score, 1.0);
    }

    static double termCoverage(CandidateDocument document, List<String> queryTerms) {
        if (queryTerms.isEmpty()) {
            return 0.0;
        }
        String content = document.getContent() != null ? document.getContent().toLowerCase(Locale.ROOT) : "";
        String title = document.getTitle() != null ? document.getTitle().toLowerCase(Locale.ROOT) : "";
        long found = queryTerms.stream()
                .filter(term -> content.contains(term) || title.contains(term))
                .count();
        return (double) found / queryTerms.size();
    }

    static double recencyBonus(Instant publishedAt, Instant now) {
        if (publishedAt == null) {
            return 0.0;
        }
        double monthsOld = Math.max(0.0, (double) Duration.between(publishedAt, now).toMillis() / MILLIS_PER_MONTH);
        return RECENCY_WEIGHT * Math.max(0.0, 1.0 - monthsOld / RECENCY_HORIZON_MONTHS);
    }
}
