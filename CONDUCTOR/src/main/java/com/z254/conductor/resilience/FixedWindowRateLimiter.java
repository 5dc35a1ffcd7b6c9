package com.z254.conductor.resilience;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed-window request counter per logical API name.
 */
public class FixedWindowRateLimiter {

    private final int maxRequestsPerWindow;
    private final Duration windowSize;
    private final Clock clock;
    private final Map<String, Window> windows = new ConcurrentHashMap<>();

    public FixedWindowRateLimiter(int maxRequestsPerWindow, Duration windowSize, Clock clock) {
        if (maxRequestsPerWindow < 1) {
            throw new IllegalArgumentException("maxRequestsPerWindow must be positive");
        }
        this.maxRequestsPerWindow = maxRequestsPerWindow;
        this.windowSize = windowSize;
        this.clock = clock;
    }

    /**
     * Consume one request slot for the API if the current window allows it.
     */
    public Decision tryAcquire(String apiName) {
        return windows.computeIfAbsent(apiName, name -> new Window(clock.instant()))
                .tryConsume(clock.instant());
    }

    public int getRemaining(String apiName) {
        Window window = windows.get(apiName);
        return window == null ? maxRequestsPerWindow : window.remaining(clock.instant());
    }

    public void reset() {
        windows.clear();
    }

    private class Window {
        private Instant windowStart;
        private int count;

        Window(Instant windowStart) {
            this.windowStart = windowStart;
        }

        synchronized Decision tryConsume(Instant now) {
            if (!now.isBefore(windowStart.plus(windowSize))) {
                windowStart = now;
                count = 0;
            }
            if (count >= maxRequestsPerWindow) {
                return Decision.rejected(Duration.between(now, windowStart.plus(windowSize)));
            }
            count++;
            return Decision.allowed(maxRequestsPerWindow - count);
        }

        synchronized int remaining(Instant now) {
            if (!now.isBefore(windowStart.plus(windowSize))) {
                return maxRequestsPerWindow;
            }
            return Math.max(0, maxRequestsPerWindow - count);
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Decision {
        private boolean allowed;
        private int remaining;
        private Duration retryAfter;

        public static Decision allowed(int remaining) {
            return Decision.builder().allowed(true).remaining(remaining).retryAfter(Duration.ZERO).build();
        }

        public static Decision rejected(Duration retryAfter) {
            return Decision.builder().allowed(false).remaining(0).retryAfter(retryAfter).build();
        }
    }
}
