package com.example.userimport.ingestion.support;

import com.univocity.parsers.common.TextParsingException;
import com.univocity.parsers.csv.CsvParser;
import java.io.IOException;
import java.io.Reader;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class CsvUserRecordIterator implements Iterator<Map<String, String>>, AutoCloseable {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final CsvParser parser;
    private final Reader reader;
    private final String sourceName;

    private String[] headers;
    private Map<String, String> pending;
    private boolean exhausted;
    private long rowsRead;

    CsvUserRecordIterator(CsvParser parser, Reader reader, String sourceName) {
        this.parser = parser;
        this.reader = reader;
        this.sourceName = sourceName;
        parser.beginParsing(reader);
    }

    @Override
    public boolean hasNext() {
        if (pending == null && !exhausted) {
            pending = readNext();
        }
        return pending != null;
    }

    @Override
    public Map<String, String> next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more records in " + sourceName);
        }
        Map<String, String> record = pending;
        pending = null;
        return record;
    }

    public long rowsRead() {
        return rowsRead;
    }

    @Override
    public void close() {
        exhausted = true;
        parser.stopParsing();
        try {
            reader.close();
        } catch (IOException ex) {
            log.warn("Failed to close CSV source={}: {}", sourceName, ex.getMessage());
        }
    }

    private Map<String, String> readNext() {
        String[] row = parseNextRow();
        if (headers == null && row != null) {
            headers = normalizeHeaders(row);
            row = parseNextRow();
        }
        if (row == null) {
            exhausted = true;
            return null;
        }
        int fields = fieldCount(row);
        if (fields != headers.length) {
            throw new ImportProcessingException(ImportError.parse(
                    ImportErrorCode.CSV_PARSE_ERROR,
                    "Row length does not match header length",
                    Map.of("source", sourceName,
                            "line", parser.getContext().currentLine(),
                            "headers", headers.length,
                            "values", fields)));
        }
        rowsRead++;
        Map<String, String> record = new LinkedHashMap<>();
        for (int i = 0; i < headers.length; i++) {
            if (!headers[i].isEmpty()) {
                record.put(headers[i], row[i]);
            }
        }
        return record;
    }

    private String[] parseNextRow() {
        try {
            return parser.parseNext();
        } catch (TextParsingException ex) {
            throw new ImportProcessingException(ImportError.parse(
                    ImportErrorCode.CSV_PARSE_ERROR,
                    "Malformed CSV content",
                    Map.of("source", sourceName, "line", ex.getLineIndex()))
                    .withCause(ex));
        }
    }

    // parsed fields carry the "" null value; trailing nulls are padding
    private static int fieldCount(String[] row) {
        int count = row.length;
        while (count > 0 && row[count - 1] == null) {
            count--;
        }
        return count;
    }

    private static String[] normalizeHeaders(String[] row) {
        String[] normalized = Arrays.stream(row)
                .map(value -> value == null ? "" : value.trim())
                .toArray(String[]::new);
        if (normalized.length > 0 && !normalized[0].isEmpty() && normalized[0].charAt(0) == BYTE_ORDER_MARK) {
            normalized[0] = normalized[0].substring(1).trim();
        }
        return normalized;
    }
}
