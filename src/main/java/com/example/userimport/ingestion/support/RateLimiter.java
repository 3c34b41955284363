package com.example.userimport.ingestion.support;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

@Slf4j
public class RateLimiter {

    private final int concurrency;
    private final Semaphore slots;
    private final Executor executor;

    public RateLimiter(Integer concurrency, Executor executor) {
        this.concurrency = concurrency == null || concurrency <= 0 ? 1 : concurrency;
        this.slots = new Semaphore(this.concurrency, true);
        this.executor = Objects.requireNonNull(executor, "executor");
        log.debug("Created rate limiter concurrency={} requested={}", this.concurrency, concurrency);
    }

    public int concurrency() {
        return concurrency;
    }

    public int availableSlots() {
        return slots.availablePermits();
    }

    public <T> T run(Supplier<T> task) {
        acquire();
        try {
            return task.get();
        } finally {
            slots.release();
        }
    }

    /**
     * Blocks the caller until a slot is free, then runs {@code task} on the executor. The slot is released
     * when the task completes, normally or not.
     */
    public <T> CompletableFuture<T> submit(Supplier<T> task) {
        acquire();
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        try {
            return CompletableFuture.supplyAsync(() -> runWithMdc(task, mdc), executor);
        } catch (RuntimeException ex) {
            slots.release();
            throw ex;
        }
    }

    private <T> T runWithMdc(Supplier<T> task, Map<String, String> mdc) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (mdc != null) {
            MDC.setContextMap(mdc);
        }
        try {
            return task.get();
        } finally {
            slots.release();
            if (previous != null) {
                MDC.setContextMap(previous);
            } else {
                MDC.clear();
            }
        }
    }

    private void acquire() {
        try {
            slots.acquire();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw ImportProcessingException.wrap(ex);
        }
    }
}
