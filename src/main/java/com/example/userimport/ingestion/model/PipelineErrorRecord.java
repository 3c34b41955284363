package com.example.userimport.ingestion.model;

import com.example.userimport.ingestion.support.ImportError;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record PipelineErrorRecord(FailureStage stage, ImportError error, Map<String, Object> context) {

    public PipelineErrorRecord {
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public static PipelineErrorRecord validation(ImportError error, Map<String, String> raw) {
        Map<String, String> snapshot = Collections.unmodifiableMap(new LinkedHashMap<>(raw));
        return new PipelineErrorRecord(FailureStage.VALIDATION, error, Map.of("raw", snapshot));
    }

    public static PipelineErrorRecord persistence(BulkUpsertFailure failure) {
        return new PipelineErrorRecord(FailureStage.PERSISTENCE, failure.error(), Map.of("id", failure.user().id()));
    }
}
