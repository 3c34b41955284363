package com.example.userimport.ingestion.model;

public record PipelineStats(long total, long validated, long persisted, long skipped, long failed) {

    public static PipelineStats derive(long total, int validationErrors, int skipped, BulkUpsertResult bulk) {
        return new PipelineStats(
                total,
                total - validationErrors,
                bulk.successes().size(),
                skipped,
                (long) validationErrors + bulk.failures().size());
    }
}
