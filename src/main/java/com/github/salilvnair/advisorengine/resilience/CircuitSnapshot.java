package com.github.salilvnair.advisorengine.resilience;

import java.time.Instant;

public record CircuitSnapshot(
        String name,
        CircuitState state,
        int failureCount,
        int failureThreshold,
        long recoveryTimeoutMs,
        Instant lastFailureAt
) {}
