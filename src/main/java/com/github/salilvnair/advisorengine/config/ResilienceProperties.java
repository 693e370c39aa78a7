package com.github.salilvnair.advisorengine.config;

import com.github.salilvnair.advisorengine.resilience.RetryPolicy;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public final class ResilienceProperties {

    private ResilienceProperties() {
    }

    @Getter
    @Setter
    public static class Retry {
        private int maxAttempts = 3;
        private long initialBackoffMs = 1000L;
        private long maxBackoffMs = 5000L;
        private double backoffMultiplier = 2.0d;
        private List<Integer> retryStatusCodes = new ArrayList<>(List.of(429, 500, 502, 503, 504, 529));

        public RetryPolicy toPolicy() {
            return RetryPolicy.of(
                    Math.max(maxAttempts, 1),
                    Math.max(initialBackoffMs, 0L),
                    Math.max(maxBackoffMs, 0L),
                    Math.max(backoffMultiplier, 1.0d));
        }
    }

    @Getter
    @Setter
    public static class Circuit {
        private int failureThreshold = 5;
        private long recoveryTimeoutMs = 60000L;

        public Duration recoveryTimeout() {
            return Duration.ofMillis(Math.max(recoveryTimeoutMs, 0L));
        }
    }
}
