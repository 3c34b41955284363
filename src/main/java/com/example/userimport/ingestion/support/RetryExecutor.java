package com.example.userimport.ingestion.support;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class RetryExecutor {

    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    public RetryExecutor(RetryPolicy policy) {
        this(policy, Sleeper.THREAD, () -> ThreadLocalRandom.current().nextDouble());
    }

    RetryExecutor(RetryPolicy policy, Sleeper sleeper, DoubleSupplier random) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.random = Objects.requireNonNull(random, "random");
    }

    public <T> T execute(RetryableOperation<T> operation) {
        return execute(operation, RetryContext.ANONYMOUS);
    }

    public <T> T execute(RetryableOperation<T> operation, RetryContext context) {
        RetryContext ctx = context == null ? RetryContext.ANONYMOUS : context;
        int attempt = 1;
        while (true) {
            T value;
            try {
                value = operation.attempt(attempt);
            } catch (RuntimeException ex) {
                logFailedAttempt(ctx, attempt, ex);
                if (attempt >= policy.maxAttempts()) {
                    throw ex;
                }
                pause(computeDelay(attempt));
                attempt++;
                continue;
            }
            if (attempt > 1) {
                log.info("Retry succeeded operation={} spanId={} attempt={}",
                        ctx.operationName(), ctx.spanId(), attempt);
            }
            return value;
        }
    }

    /**
     * Uniform draw from {@code [0, min(maxDelay, baseDelay * factor^(attempt-1)))}.
     */
    Duration computeDelay(int attempt) {
        double baseMillis = policy.baseDelay().toMillis();
        double exponential = baseMillis * Math.pow(policy.factor(), Math.max(0, attempt - 1));
        double capped = Math.min(policy.maxDelay().toMillis(), exponential);
        return Duration.ofMillis((long) Math.floor(random.getAsDouble() * capped));
    }

    private void pause(Duration delay) {
        if (delay.isZero()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw ImportProcessingException.wrap(ex);
        }
    }

    private static void logFailedAttempt(RetryContext ctx, int attempt, RuntimeException ex) {
        if (ex instanceof ImportProcessingException importFailure) {
            log.warn("Retry attempt failed operation={} spanId={} attempt={} type={} code={}",
                    ctx.operationName(), ctx.spanId(), attempt, importFailure.getType(), importFailure.getCode());
        } else {
            log.warn("Retry attempt failed operation={} spanId={} attempt={} type={} code={}",
                    ctx.operationName(), ctx.spanId(), attempt, ImportErrorType.UNKNOWN_ERROR,
                    ex.getClass().getSimpleName());
        }
    }
}
