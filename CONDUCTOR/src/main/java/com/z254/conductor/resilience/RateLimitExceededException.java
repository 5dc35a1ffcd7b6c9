package com.z254.conductor.resilience;

import lombok.Getter;

import java.time.Duration;

/**
 * Raised when an external call is rejected by the rate limiter. Retryable after {@link #getRetryAfter()}.
 */
@Getter
public class RateLimitExceededException extends RuntimeException {

    private final String apiName;
    private final Duration retryAfter;

    public RateLimitExceededException(String apiName, Duration retryAfter) {
        super("Rate limit exceeded for " + apiName + ", retry after " + retryAfter.toMillis() + "ms");
        this.apiName = apiName;
        this.retryAfter = retryAfter;
    }

    public boolean isRetryable() {
        return true;
    }
}
