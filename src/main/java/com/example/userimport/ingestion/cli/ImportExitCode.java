package com.example.userimport.ingestion.cli;

import com.example.userimport.ingestion.model.PipelineOutput;

public enum ImportExitCode {
    SUCCESS(0),
    FATAL(1),
    PARTIAL(2);

    private final int code;

    ImportExitCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static ImportExitCode of(PipelineOutput output) {
        return output.hasErrors() || !output.skipped().isEmpty() ? PARTIAL : SUCCESS;
    }
}
