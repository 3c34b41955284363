package com.example.userimport.ingestion.support;

import com.univocity.parsers.csv.CsvParser;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class UserCsvReader {

    public static final String STDIN_SOURCE = "-";

    private final CamelCsvParserFactory parserFactory;
    private final CompressionSupport compressionSupport;

    /**
     * Opens a file path, or standard input when {@code source} is {@code "-"}.
     */
    public CsvUserRecordIterator open(String source) {
        if (source == null || STDIN_SOURCE.equals(source)) {
            return open(System.in, "stdin");
        }
        InputStream raw;
        try {
            raw = Files.newInputStream(Path.of(source));
        } catch (IOException | RuntimeException ex) {
            throw new ImportProcessingException(ImportError.parse(
                    ImportErrorCode.CSV_READ_ERROR,
                    "Failed to open CSV source",
                    Map.of("source", source))
                    .withCause(ex));
        }
        return open(raw, source);
    }

    public CsvUserRecordIterator open(InputStream rawStream, String sourceName) {
        CsvParser parser = parserFactory.newParser();
        try {
            Reader reader = compressionSupport.openReader(rawStream, sourceName);
            log.info("Opened CSV source={}", sourceName);
            return new CsvUserRecordIterator(parser, reader, sourceName);
        } catch (IOException ex) {
            closeQuietly(rawStream, sourceName);
            throw new ImportProcessingException(ImportError.parse(
                    ImportErrorCode.CSV_READ_ERROR,
                    "Failed to read CSV source",
                    Map.of("source", sourceName))
                    .withCause(ex));
        }
    }

    private static void closeQuietly(InputStream stream, String sourceName) {
        try {
            stream.close();
        } catch (IOException ex) {
            log.warn("Failed to close source={} after read failure: {}", sourceName, ex.getMessage());
        }
    }
}
