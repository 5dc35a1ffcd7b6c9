package com.z254.conductor.retrieval;

import com.z254.conductor.domain.model.CandidateDocument;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Derives a duplicate-detection key from a document's source and the opening of its text.
 */
public final class ContentFingerprinter {

    static final int EXCERPT_LENGTH = 100;
    static final int MAX_WORDS = 10;
    static final int MIN_WORD_LENGTH = 4;

    private ContentFingerprinter() {
    }

    public static String fingerprint(CandidateDocument document) {
        String source = document.getSourceStrategy() != null
                ? document.getSourceStrategy().getWireName()
                : "unknown";

        String text = document.getContent();
        if (text == null || text.isBlank()) {
            text = document.getTitle() != null ? document.getTitle() : "";
        }

        String excerpt = text.substring(0, Math.min(EXCERPT_LENGTH, text.length()))
                .toLowerCase(Locale.ROOT)
                .trim();

        String words = Arrays.stream(excerpt.split("\\s+"))
                .filter(word -> word.length() >= MIN_WORD_LENGTH)
                .limit(MAX_WORDS)
                .sorted()
                .collect(Collectors.joining("|"));

        return source + ":" + words;
    }
}
