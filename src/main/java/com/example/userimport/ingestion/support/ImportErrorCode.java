package com.example.userimport.ingestion.support;

public enum ImportErrorCode {
    CSV_READ_ERROR,
    CSV_PARSE_ERROR,
    VALIDATION_FAILED,
    POLICY_DISPOSABLE_EMAIL,
    POLICY_DUPLICATE,
    POLICY_STALE_UPDATE,
    REPO_WRITE_FAILED,
    CONFIG_INVALID,
    CONFIG_MISSING,
    UNKNOWN
}
