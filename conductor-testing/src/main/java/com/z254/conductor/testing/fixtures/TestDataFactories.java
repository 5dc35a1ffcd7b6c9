package com.z254.conductor.testing.fixtures;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Factory utilities for generating test data across CONDUCTOR modules.
 *
 * <p>Provides consistent test data generation patterns for:</p>
 * <ul>
 *   <li>Unique identifiers (UUIDs, sequence IDs)</li>
 *   <li>Psychology domains and content types</li>
 *   <li>Timestamps relative to a fixed instant</li>
 *   <li>Seeded random text and relevance values</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * String id = TestDataFactories.uniqueId("wf");           // "wf-a1b2c3d4"
 * Random random = TestDataFactories.seeded(42L);
 * String text = TestDataFactories.randomText(random, 12); // "anxiety coping ..."
 * double relevance = TestDataFactories.randomRelevance(random);
 * }</pre>
 */
public final class TestDataFactories {

    private static final AtomicLong sequenceCounter = new AtomicLong(0);

    /**
     * Fixed reference instant used by clocks and document dates in tests.
     */
    public static final Instant REFERENCE_INSTANT = Instant.parse("2024-06-01T12:00:00Z");

    public static final List<String> DOMAINS = List.of(
            "clinical-psychology", "educational-psychology",
            "organizational-psychology", "health-psychology"
    );

    public static final List<String> CONTENT_TYPES = List.of(
            "therapeutic-program", "assessment-tool", "technique-library", "comprehensive-program"
    );

    private static final List<String> VOCABULARY = List.of(
            "stress", "management", "techniques", "anxiety", "coping", "therapy",
            "cognitive", "behavioral", "mindfulness", "resilience", "assessment",
            "learning", "workplace", "wellness", "evidence", "intervention",
            "outcome", "protocol", "session", "relaxation", "breathing", "journal"
    );

    private TestDataFactories() {
        // Prevent instantiation
    }

    // ==========================================================================
    // Unique Identifiers
    // ==========================================================================

    /**
     * Generate a unique ID with the given prefix.
     *
     * @param prefix the ID prefix (e.g., "wf", "doc")
     * @return unique ID like "wf-a1b2c3d4"
     */
    public static String uniqueId(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Generate a sequential ID, unique within the JVM.
     */
    public static String sequentialId(String prefix) {
        return prefix + "-" + sequenceCounter.incrementAndGet();
    }

    // ==========================================================================
    // Timestamps
    // ==========================================================================

    public static Instant daysBefore(Instant reference, long days) {
        return reference.minus(days, ChronoUnit.DAYS);
    }

    public static Instant monthsBefore(Instant reference, long months) {
        return reference.minus(months * 30, ChronoUnit.DAYS);
    }

    // ==========================================================================
    // Seeded random data
    // ==========================================================================

    public static Random seeded(long seed) {
        return new Random(seed);
    }

    /**
     * Space separated words drawn from a fixed psychology vocabulary.
     */
    public static String randomText(Random random, int words) {
        List<String> picked = new ArrayList<>(words);
        for (int i = 0; i < words; i++) {
            picked.add(VOCABULARY.get(random.nextInt(VOCABULARY.size())));
        }
        return String.join(" ", picked);
    }

    /**
     * Relevance in [0, 1] rounded to two decimals.
     */
    public static double randomRelevance(Random random) {
        return Math.round(random.nextDouble() * 100) / 100.0;
    }

    public static String randomDomain(Random random) {
        return DOMAINS.get(random.nextInt(DOMAINS.size()));
    }
}
