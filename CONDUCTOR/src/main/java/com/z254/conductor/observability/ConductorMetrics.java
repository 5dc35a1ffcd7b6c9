package com.z254.conductor.observability;

import com.z254.conductor.domain.model.OrchestratorStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Centralized metrics for CONDUCTOR service.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Knowledge retrieval (searches, success rate, cache hit rate, latency)</li>
 *     <li>External API calls (requests, rate limit hits, timeouts, in-flight calls)</li>
 *     <li>Workflows (lifecycle, refinements, quality, per-phase timing)</li>
 * </ul>
 * Micrometer meters are monotonic; the running figures behind the status report
 * are kept alongside them so that a retrieval reset can clear them.
 */
@Component
public class ConductorMetrics {

    private final MeterRegistry meterRegistry;

    // Retrieval metrics
    private final Counter searches;
    private final Counter searchesSuccessful;
    private final Counter cacheHits;
    private final Timer searchLatency;
    private final AtomicLong totalSearches = new AtomicLong();
    private final AtomicLong successfulSearches = new AtomicLong();
    private final AtomicLong cacheHitCount = new AtomicLong();
    private final RunningAverage searchResponseTime = new RunningAverage();

    // External API metrics
    private final Counter externalSuccess;
    private final Counter externalFailure;
    @Getter
    private final Counter rateLimitHits;
    @Getter
    private final Counter timeouts;
    private final Timer externalLatency;
    private final AtomicInteger activeExternalRequests;
    private final AtomicLong externalTotal = new AtomicLong();
    private final AtomicLong externalSucceeded = new AtomicLong();
    private final AtomicLong externalFailed = new AtomicLong();
    private final AtomicLong rateLimitHitCount = new AtomicLong();
    private final AtomicLong timeoutCount = new AtomicLong();
    private final RunningAverage externalResponseTime = new RunningAverage();

    // Workflow metrics
    @Getter
    private final Counter workflowsStarted;
    @Getter
    private final Counter workflowsCompleted;
    @Getter
    private final Counter workflowsFailed;
    @Getter
    private final Counter refinements;
    @Getter
    private final Counter qualityGateMisses;
    private final Timer workflowDuration;
    private final DistributionSummary qualityScore;
    private final AtomicInteger activeWorkflows;
    private final AtomicLong workflowsProcessed = new AtomicLong();
    private final AtomicLong workflowsSucceeded = new AtomicLong();
    private final RunningAverage averageQuality = new RunningAverage();
    private final RunningAverage averageCompletionTime = new RunningAverage();
    private final Map<String, Timer> phaseTimers = new ConcurrentHashMap<>();
    private final Map<String, RunningAverage> phaseAverages = new ConcurrentHashMap<>();

    public ConductorMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.searches = Counter.builder("conductor.retrieval.searches")
                .description("Knowledge searches requested")
                .register(meterRegistry);
        this.searchesSuccessful = Counter.builder("conductor.retrieval.searches.successful")
                .description("Knowledge searches completed without error")
                .register(meterRegistry);
        this.cacheHits = Counter.builder("conductor.retrieval.cache.hits")
                .description("Knowledge searches served from cache")
                .register(meterRegistry);
        this.searchLatency = Timer.builder("conductor.retrieval.latency")
                .description("Knowledge search latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);

        this.externalSuccess = Counter.builder("conductor.external.requests")
                .tag("result", "success")
                .description("External API requests")
                .register(meterRegistry);
        this.externalFailure = Counter.builder("conductor.external.requests")
                .tag("result", "failure")
                .description("External API requests")
                .register(meterRegistry);
        this.rateLimitHits = Counter.builder("conductor.external.rate_limit_hits")
                .description("External API calls rejected by the rate limiter")
                .register(meterRegistry);
        this.timeouts = Counter.builder("conductor.external.timeouts")
                .description("External API calls that timed out")
                .register(meterRegistry);
        this.externalLatency = Timer.builder("conductor.external.latency")
                .description("External API call latency")
                .register(meterRegistry);
        this.activeExternalRequests = meterRegistry.gauge("conductor.external.active", new AtomicInteger(0));

        this.workflowsStarted = Counter.builder("conductor.workflow.started")
                .description("Content workflows started")
                .register(meterRegistry);
        this.workflowsCompleted = Counter.builder("conductor.workflow.completed")
                .description("Content workflows completed")
                .register(meterRegistry);
        this.workflowsFailed = Counter.builder("conductor.workflow.failed")
                .description("Content workflows failed")
                .register(meterRegistry);
        this.refinements = Counter.builder("conductor.workflow.refinements")
                .description("Refinement passes executed")
                .register(meterRegistry);
        this.qualityGateMisses = Counter.builder("conductor.workflow.quality_gate.missed")
                .description("Workflows returned below the quality threshold")
                .register(meterRegistry);
        this.workflowDuration = Timer.builder("conductor.workflow.duration")
                .description("End-to-end content workflow duration")
                .publishPercentiles(0.5, 0.95)
                .register(meterRegistry);
        this.qualityScore = DistributionSummary.builder("conductor.workflow.quality")
                .description("Final quality score of produced content")
                .register(meterRegistry);
        this.activeWorkflows = meterRegistry.gauge("conductor.workflow.active", new AtomicInteger(0));
    }

    // =========================================================================
    // Retrieval
    // =========================================================================

    public void searchStarted() {
        searches.increment();
        totalSearches.incrementAndGet();
    }

    public void cacheHit() {
        cacheHits.increment();
        cacheHitCount.incrementAndGet();
    }

    public void searchCompleted(boolean success, long responseTimeMs) {
        if (success) {
            searchesSuccessful.increment();
            successfulSearches.incrementAndGet();
        }
        searchLatency.record(Duration.ofMillis(responseTimeMs));
        searchResponseTime.record(responseTimeMs);
    }

    public void resetRetrieval() {
        totalSearches.set(0);
        successfulSearches.set(0);
        cacheHitCount.set(0);
        searchResponseTime.reset();
    }

    public OrchestratorStatus.RetrievalStats retrievalStats() {
        long total = totalSearches.get();
        return OrchestratorStatus.RetrievalStats.builder()
                .totalSearches(total)
                .successfulSearches(successfulSearches.get())
                .cacheHits(cacheHitCount.get())
                .averageResponseTimeMs(searchResponseTime.getMean())
                .successRate(ratio(successfulSearches.get(), total))
                .cacheHitRate(ratio(cacheHitCount.get(), total))
                .build();
    }

    // =========================================================================
    // External APIs
    // =========================================================================

    public void externalRequestStarted() {
        externalTotal.incrementAndGet();
        activeExternalRequests.incrementAndGet();
    }

    public void externalRequestFinished(boolean success, long responseTimeMs) {
        activeExternalRequests.decrementAndGet();
        if (success) {
            externalSuccess.increment();
            externalSucceeded.incrementAndGet();
        } else {
            externalFailure.increment();
            externalFailed.incrementAndGet();
        }
        externalLatency.record(Duration.ofMillis(responseTimeMs));
        externalResponseTime.record(responseTimeMs);
    }

    public void rateLimitHit() {
        rateLimitHits.increment();
        rateLimitHitCount.incrementAndGet();
    }

    public void externalTimeout() {
        timeouts.increment();
        timeoutCount.incrementAndGet();
    }

    public OrchestratorStatus.ExternalApiStats externalApiStats() {
        return OrchestratorStatus.ExternalApiStats.builder()
                .totalRequests(externalTotal.get())
                .successfulRequests(externalSucceeded.get())
                .failedRequests(externalFailed.get())
                .rateLimitHits(rateLimitHitCount.get())
                .timeoutCount(timeoutCount.get())
                .activeRequests(activeExternalRequests.get())
                .averageResponseTimeMs(externalResponseTime.getMean())
                .build();
    }

    // =========================================================================
    // Workflows
    // =========================================================================

    public void workflowStarted() {
        workflowsStarted.increment();
        activeWorkflows.incrementAndGet();
    }

    public void workflowFinished(boolean success, long completionTimeMs, Double quality) {
        activeWorkflows.decrementAndGet();
        workflowsProcessed.incrementAndGet();
        workflowDuration.record(Duration.ofMillis(completionTimeMs));
        if (success) {
            workflowsCompleted.increment();
            workflowsSucceeded.incrementAndGet();
            averageCompletionTime.record(completionTimeMs);
        } else {
            workflowsFailed.increment();
        }
        if (quality != null) {
            qualityScore.record(quality);
            averageQuality.record(quality);
        }
    }

    public void refinementTriggered() {
        refinements.increment();
    }

    public void qualityGateMissed() {
        qualityGateMisses.increment();
    }

    public void recordPhase(String phaseName, long durationMs, boolean success) {
        phaseTimers.computeIfAbsent(phaseName, name -> Timer.builder("conductor.workflow.phase.duration")
                        .tag("phase", name)
                        .description("Workflow phase duration")
                        .register(meterRegistry))
                .record(Duration.ofMillis(durationMs));
        phaseAverages.computeIfAbsent(phaseName, name -> new RunningAverage()).record(durationMs);
        if (!success) {
            meterRegistry.counter("conductor.workflow.phase.failed", "phase", phaseName).increment();
        }
    }

    public Map<String, Double> averagePhaseDurations() {
        Map<String, Double> averages = new LinkedHashMap<>();
        new TreeMap<>(phaseAverages).forEach((phase, average) -> averages.put(phase, average.getMean()));
        return averages;
    }

    public long getWorkflowsProcessed() {
        return workflowsProcessed.get();
    }

    public double getWorkflowSuccessRate() {
        return ratio(workflowsSucceeded.get(), workflowsProcessed.get());
    }

    public double getAverageQuality() {
        return averageQuality.getMean();
    }

    public double getAverageCompletionTimeMs() {
        return averageCompletionTime.getMean();
    }

    private static double ratio(long part, long total) {
        return total == 0 ? 0.0 : (double) part / total;
    }
}
