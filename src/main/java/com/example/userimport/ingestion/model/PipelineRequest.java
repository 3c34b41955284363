package com.example.userimport.ingestion.model;

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

public record PipelineRequest(
        Iterator<Map<String, String>> source,
        String idempotencyKey,
        Boolean failFast,
        String spanId) {

    public PipelineRequest {
        Objects.requireNonNull(source, "source");
    }
}
