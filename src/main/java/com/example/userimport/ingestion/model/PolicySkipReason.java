package com.example.userimport.ingestion.model;

import com.example.userimport.ingestion.support.ImportErrorCode;

public enum PolicySkipReason {
    DISPOSABLE_EMAIL("disposable-email", ImportErrorCode.POLICY_DISPOSABLE_EMAIL),
    STALE_UPDATE("stale-update", ImportErrorCode.POLICY_STALE_UPDATE),
    DUPLICATE("duplicate", ImportErrorCode.POLICY_DUPLICATE);

    private final String label;
    private final ImportErrorCode code;

    PolicySkipReason(String label, ImportErrorCode code) {
        this.label = label;
        this.code = code;
    }

    public String label() {
        return label;
    }

    public ImportErrorCode code() {
        return code;
    }
}
