package com.example.userimport.ingestion.model;

public enum FailureStage {
    VALIDATION("validation"),
    PERSISTENCE("persistence");

    private final String label;

    FailureStage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
