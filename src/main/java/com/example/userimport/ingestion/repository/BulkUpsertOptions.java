package com.example.userimport.ingestion.repository;

import com.example.userimport.ingestion.support.RateLimiter;
import com.example.userimport.ingestion.support.RetryExecutor;
import java.util.Objects;

/**
 * @param idempotencyKey replay scope shared by every write of the batch, may be null
 * @param rateLimiter    bounds concurrent writes when {@code failFast} is false
 * @param retryExecutor  wraps each individual write
 * @param failFast       sequential writes that stop at the first failure instead of concurrent best-effort writes
 * @param spanId         correlation id for retry logs, may be null
 */
public record BulkUpsertOptions(
        String idempotencyKey,
        RateLimiter rateLimiter,
        RetryExecutor retryExecutor,
        boolean failFast,
        String spanId) {

    public BulkUpsertOptions {
        Objects.requireNonNull(rateLimiter, "rateLimiter");
        Objects.requireNonNull(retryExecutor, "retryExecutor");
    }
}
