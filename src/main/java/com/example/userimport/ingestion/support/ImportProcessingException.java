package com.example.userimport.ingestion.support;

import java.util.Objects;

public class ImportProcessingException extends RuntimeException {

    private final transient ImportError error;

    public ImportProcessingException(ImportError error) {
        super(Objects.requireNonNull(error, "error").message(), error.cause());
        this.error = error;
    }

    public ImportError getError() {
        return error;
    }

    public ImportErrorCode getCode() {
        return error.code();
    }

    public ImportErrorType getType() {
        return error.type();
    }

    /**
     * Returns {@code throwable} unchanged when it already is an import failure, otherwise wraps it as an
     * {@link ImportErrorType#UNKNOWN_ERROR} that keeps the original as its cause.
     */
    public static ImportProcessingException wrap(Throwable throwable) {
        if (throwable instanceof ImportProcessingException importFailure) {
            return importFailure;
        }
        return new ImportProcessingException(ImportError.unknown(throwable));
    }

    public static ImportError errorOf(Throwable throwable) {
        return wrap(throwable).getError();
    }
}
