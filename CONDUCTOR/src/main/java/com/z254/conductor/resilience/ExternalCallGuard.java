package com.z254.conductor.resilience;

import com.z254.conductor.observability.ConductorMetrics;
import com.z254.conductor.observability.StructuredLogger;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.reactor.bulkhead.operator.BulkheadOperator;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Wraps every external call (knowledge lookups, remote delegation) with
 * rate limiting, a bounded number of concurrent calls, a timeout and metrics.
 * <p>
 * Errors are propagated to the caller, which decides how to degrade.
 */
@Slf4j
public class ExternalCallGuard {

    private final FixedWindowRateLimiter rateLimiter;
    private final Bulkhead bulkhead;
    private final Duration timeout;
    private final ConductorMetrics metrics;
    private final StructuredLogger structuredLogger;
    private final Clock clock;

    public ExternalCallGuard(FixedWindowRateLimiter rateLimiter, Bulkhead bulkhead, Duration timeout,
                             ConductorMetrics metrics, StructuredLogger structuredLogger) {
        this(rateLimiter, bulkhead, timeout, metrics, structuredLogger, Clock.systemUTC());
    }

    public ExternalCallGuard(FixedWindowRateLimiter rateLimiter, Bulkhead bulkhead, Duration timeout,
                             ConductorMetrics metrics, StructuredLogger structuredLogger, Clock clock) {
        this.rateLimiter = rateLimiter;
        this.bulkhead = bulkhead;
        this.timeout = timeout;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    public <T> Mono<T> execute(String apiName, Supplier<Mono<T>> call) {
        return execute(apiName, timeout, call);
    }

    public <T> Mono<T> execute(String apiName, Duration callTimeout, Supplier<Mono<T>> call) {
        return Mono.defer(() -> {
            FixedWindowRateLimiter.Decision decision = rateLimiter.tryAcquire(apiName);
            if (!decision.isAllowed()) {
                metrics.rateLimitHit();
                structuredLogger.logRateLimitRejected(apiName, decision.getRetryAfter().toMillis());
                return Mono.error(new RateLimitExceededException(apiName, decision.getRetryAfter()));
            }

            long start = clock.millis();
            metrics.externalRequestStarted();

            // Waiting for a bulkhead permit blocks, so subscribe off the event loop
            return Mono.defer(call)
                    .transformDeferred(BulkheadOperator.of(bulkhead))
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(callTimeout)
                    .doOnError(TimeoutException.class, e -> {
                        metrics.externalTimeout();
                        log.warn("External call to {} timed out after {}", apiName, callTimeout);
                    })
                    .doFinally(signal -> metrics.externalRequestFinished(
                            signal == SignalType.ON_COMPLETE, clock.millis() - start));
        });
    }

    public int getAvailableSlots() {
        return bulkhead.getMetrics().getAvailableConcurrentCalls();
    }

    public int getRemainingRequests(String apiName) {
        return rateLimiter.getRemaining(apiName);
    }
}
