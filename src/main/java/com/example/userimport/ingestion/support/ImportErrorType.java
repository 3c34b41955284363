package com.example.userimport.ingestion.support;

public enum ImportErrorType {
    PARSE_ERROR,
    VALIDATION_ERROR,
    POLICY_ERROR,
    REPO_ERROR,
    CONFIG_ERROR,
    UNKNOWN_ERROR
}
