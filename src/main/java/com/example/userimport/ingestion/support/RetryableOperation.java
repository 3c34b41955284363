package com.example.userimport.ingestion.support;

@FunctionalInterface
public interface RetryableOperation<T> {

    /**
     * @param attempt 1-based attempt number
     */
    T attempt(int attempt);
}
