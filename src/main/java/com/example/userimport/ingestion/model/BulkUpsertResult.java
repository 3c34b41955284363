package com.example.userimport.ingestion.model;

import java.util.List;

/**
 * Partition of a batch write. Callers must not rely on the order of either list.
 */
public record BulkUpsertResult(List<User> successes, List<BulkUpsertFailure> failures) {

    public static final BulkUpsertResult EMPTY = new BulkUpsertResult(List.of(), List.of());

    public BulkUpsertResult {
        successes = successes == null ? List.of() : List.copyOf(successes);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public int size() {
        return successes.size() + failures.size();
    }
}
