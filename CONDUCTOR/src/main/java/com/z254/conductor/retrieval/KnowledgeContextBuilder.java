package com.z254.conductor.retrieval;

import com.z254.conductor.domain.model.CandidateDocument;
import com.z254.conductor.domain.model.KnowledgeContext;
import com.z254.conductor.domain.model.SourceStrategy;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Condenses ranked documents into the context handed to delegated tasks.
 */
@Component
public class KnowledgeContextBuilder {

    static final int TOP_RESULTS = 3;
    static final int SUMMARY_CHARS = 500;
    static final int KEY_TOPICS = 10;

    private static final Pattern WORD = Pattern.compile("\\b[a-z]{4,}\\b");

    public KnowledgeContext prepare(List<CandidateDocument> results, String taskType) {
        if (results == null || results.isEmpty()) {
            return KnowledgeContext.empty(taskType);
        }

        Map<SourceStrategy, List<CandidateDocument>> bySource = new LinkedHashMap<>();
        for (CandidateDocument document : results) {
            SourceStrategy source = document.getSourceStrategy() != null
                    ? document.getSourceStrategy()
                    : SourceStrategy.KNOWLEDGE_BASE;
            bySource.computeIfAbsent(source, s -> new ArrayList<>()).add(document);
        }

        Map<SourceStrategy, KnowledgeContext.SourceDigest> digests = new LinkedHashMap<>();
        bySource.forEach((source, documents) -> digests.put(source, KnowledgeContext.SourceDigest.builder()
                .count(documents.size())
                .topResults(List.copyOf(documents.subList(0, Math.min(TOP_RESULTS, documents.size()))))
                .summary(summarize(documents))
                .keyTopics(keyTopics(documents))
                .build()));

        double min = results.stream().mapToDouble(KnowledgeContextBuilder::relevanceOf).min().orElse(0.0);
        double max = results.stream().mapToDouble(KnowledgeContextBuilder::relevanceOf).max().orElse(0.0);

        return KnowledgeContext.builder()
                .taskType(taskType)
                .totalResults(results.size())
                .sources(new ArrayList<>(bySource.keySet()))
                .minRelevance(min)
                .maxRelevance(max)
                .bySource(digests)
                .build();
    }

    private static String summarize(List<CandidateDocument> documents) {
        return documents.stream()
                .map(CandidateDocument::getContent)
                .filter(content -> content != null && !content.isEmpty())
                .map(content -> content.substring(0, Math.min(SUMMARY_CHARS, content.length())))
                .collect(Collectors.joining("\n\n"));
    }

    static List<String> keyTopics(List<CandidateDocument> documents) {
        Map<String, Integer> frequency = new HashMap<>();
        for (CandidateDocument document : documents) {
            String text = ((document.getTitle() != null ? document.getTitle() : "") + " "
                    + (document.getContent() != null ? document.getContent() : "")).toLowerCase(Locale.ROOT);
            Matcher matcher = WORD.matcher(text);
            while (matcher.find()) {
                frequency.merge(matcher.group(), 1, Integer::sum);
            }
        }
        return frequency.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(KEY_TOPICS)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    private static double relevanceOf(CandidateDocument document) {
        if (document.getFinalScore() != null) {
            return document.getFinalScore();
        }
        return document.getRawRelevance() != null ? document.getRawRelevance() : 0.0;
    }
}
