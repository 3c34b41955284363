package com.example.userimport.ingestion.model;

import java.util.List;

public record PipelineOutput(
        String report,
        PipelineStats stats,
        List<PipelineErrorRecord> errors,
        List<SkippedUser> skipped,
        List<User> successes) {

    public PipelineOutput {
        errors = List.copyOf(errors);
        skipped = List.copyOf(skipped);
        successes = List.copyOf(successes);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
