package com.z254.conductor.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Retrieval strategy that produced a candidate document.
 */
public enum SourceStrategy {
    KNOWLEDGE_BASE("knowledge-base", 0.3),
    CODE_EXAMPLES("code-examples", 0.2),
    SPECIALIZED("specialized-content", 0.35);

    private final String wireName;
    private final double scoreWeight;

    SourceStrategy(String wireName, double scoreWeight) {
        this.wireName = wireName;
        this.scoreWeight = scoreWeight;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Weight added to the composite score of documents from this source.
     */
    public double getScoreWeight() {
        return scoreWeight;
    }
}
