package com.example.userimport.ingestion.support;

import java.time.Duration;

public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double factor) {

    public RetryPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        baseDelay = baseDelay == null || baseDelay.isNegative() ? Duration.ZERO : baseDelay;
        maxDelay = maxDelay == null || maxDelay.isNegative() ? Duration.ZERO : maxDelay;
        factor = Double.isFinite(factor) && factor >= 1 ? factor : 1;
    }
}
