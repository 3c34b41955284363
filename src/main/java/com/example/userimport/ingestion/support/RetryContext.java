package com.example.userimport.ingestion.support;

public record RetryContext(String operationName, String spanId) {

    public static final RetryContext ANONYMOUS = new RetryContext(null, null);

    public static RetryContext of(String operationName) {
        return new RetryContext(operationName, null);
    }
}
