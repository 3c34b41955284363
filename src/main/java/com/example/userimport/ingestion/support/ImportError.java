package com.example.userimport.ingestion.support;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ImportError(
        ImportErrorType type,
        ImportErrorCode code,
        String message,
        Map<String, Object> details,
        Throwable cause) {

    public ImportError {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static ImportError parse(ImportErrorCode code, String message, Map<String, Object> details) {
        return new ImportError(ImportErrorType.PARSE_ERROR, code, message, details, null);
    }

    public static ImportError validation(String message, Map<String, Object> details) {
        return new ImportError(ImportErrorType.VALIDATION_ERROR, ImportErrorCode.VALIDATION_FAILED, message,
                details, null);
    }

    public static ImportError policy(ImportErrorCode code, String message, Map<String, Object> details) {
        return new ImportError(ImportErrorType.POLICY_ERROR, code, message, details, null);
    }

    public static ImportError repo(ImportErrorCode code, String message, Map<String, Object> details,
            Throwable cause) {
        return new ImportError(ImportErrorType.REPO_ERROR, code, message, details, cause);
    }

    public static ImportError config(ImportErrorCode code, String message) {
        return new ImportError(ImportErrorType.CONFIG_ERROR, code, message, Map.of(), null);
    }

    public static ImportError unknown(Throwable cause) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (cause != null) {
            details.put("exception", cause.getClass().getName());
            if (cause.getMessage() != null) {
                details.put("reason", cause.getMessage());
            }
        }
        return new ImportError(ImportErrorType.UNKNOWN_ERROR, ImportErrorCode.UNKNOWN,
                "An unexpected error occurred", details, cause);
    }

    public ImportError withCause(Throwable newCause) {
        return new ImportError(type, code, message, details, newCause);
    }
}
