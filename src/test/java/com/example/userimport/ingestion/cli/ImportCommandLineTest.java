package com.example.userimport.ingestion.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.userimport.ingestion.support.ImportErrorCode;
import com.example.userimport.ingestion.support.ImportErrorType;
import com.example.userimport.ingestion.support.ImportProcessingException;
import java.util.List;
import org.junit.jupiter.api.Test;

class ImportCommandLineTest {

    @Test
    void defaultsToStandardInput() {
        assertThat(ImportCommandLine.parse(List.of())).isEqualTo(new ImportCommandLine("-", null, null));
    }

    @Test
    void parsesLongFlags() {
        ImportCommandLine commandLine = ImportCommandLine.parse(
                List.of("--source", "users.csv", "--idempotency", "batch-7", "--fail-fast"));

        assertThat(commandLine).isEqualTo(new ImportCommandLine("users.csv", "batch-7", Boolean.TRUE));
    }

    @Test
    void parsesShortFlags() {
        ImportCommandLine commandLine = ImportCommandLine.parse(List.of("-i", "k1", "-s", "in.csv.gz"));

        assertThat(commandLine.source()).isEqualTo("in.csv.gz");
        assertThat(commandLine.idempotencyKey()).isEqualTo("k1");
        assertThat(commandLine.failFast()).isNull();
    }

    @Test
    void missingFlagValueIsAConfigError() {
        assertThatThrownBy(() -> ImportCommandLine.parse(List.of("--source")))
                .isInstanceOfSatisfying(ImportProcessingException.class, ex -> {
                    assertThat(ex.getType()).isEqualTo(ImportErrorType.CONFIG_ERROR);
                    assertThat(ex.getCode()).isEqualTo(ImportErrorCode.CONFIG_MISSING);
                })
                .hasMessage("Missing value for --source");
    }

    @Test
    void unknownArgumentIsAConfigError() {
        assertThatThrownBy(() -> ImportCommandLine.parse(List.of("--verbose")))
                .isInstanceOfSatisfying(ImportProcessingException.class, ex ->
                        assertThat(ex.getCode()).isEqualTo(ImportErrorCode.CONFIG_INVALID))
                .hasMessage("Unknown CLI argument: --verbose");
    }
}
