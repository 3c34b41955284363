package com.example.userimport.ingestion.model;

public enum PipelineStage {
    STREAMING,
    ACCUMULATING,
    PERSISTING,
    REPORTING,
    DONE
}
