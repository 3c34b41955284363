package com.example.userimport.ingestion.cli;

import com.example.userimport.ingestion.model.PipelineOutput;
import com.example.userimport.ingestion.model.PipelineRequest;
import com.example.userimport.ingestion.service.UserImportPipeline;
import com.example.userimport.ingestion.support.CsvUserRecordIterator;
import com.example.userimport.ingestion.support.ImportProcessingException;
import com.example.userimport.ingestion.support.UserCsvReader;
import java.io.PrintStream;
import java.util.Arrays;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ImportCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    private final UserImportPipeline pipeline;
    private final UserCsvReader csvReader;
    private final PrintStream out;
    private final PrintStream err;

    private volatile ImportExitCode exitCode = ImportExitCode.SUCCESS;

    @Autowired
    public ImportCommandLineRunner(UserImportPipeline pipeline, UserCsvReader csvReader) {
        this(pipeline, csvReader, System.out, System.err);
    }

    ImportCommandLineRunner(UserImportPipeline pipeline, UserCsvReader csvReader, PrintStream out,
            PrintStream err) {
        this.pipeline = pipeline;
        this.csvReader = csvReader;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args.getSourceArgs());
    }

    ImportExitCode execute(String... args) {
        try {
            ImportCommandLine commandLine = ImportCommandLine.parse(Arrays.asList(args));
            try (CsvUserRecordIterator records = csvReader.open(commandLine.source())) {
                PipelineOutput output = pipeline.run(new PipelineRequest(
                        records, commandLine.idempotencyKey(), commandLine.failFast(), null));
                out.println(output.report());
                ImportExitCode outcome = ImportExitCode.of(output);
                if (outcome == ImportExitCode.PARTIAL) {
                    log.warn("Pipeline completed with partial failures errors={} skipped={}",
                            output.errors().size(), output.skipped().size());
                } else {
                    log.info("Pipeline succeeded persisted={}", output.stats().persisted());
                }
                return outcome;
            }
        } catch (ImportProcessingException ex) {
            log.error("Import failed type={} code={}", ex.getType(), ex.getCode());
            err.println(ex.getMessage());
            return ImportExitCode.FATAL;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode.code();
    }
}
