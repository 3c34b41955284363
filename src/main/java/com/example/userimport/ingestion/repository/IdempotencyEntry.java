package com.example.userimport.ingestion.repository;

import java.time.Instant;
import java.util.Set;

record IdempotencyEntry(Instant expiresAt, Set<String> memberIds) {

    boolean isLive(Instant now) {
        return now.isBefore(expiresAt);
    }

    boolean covers(String id, Instant now) {
        return isLive(now) && memberIds.contains(id);
    }
}
