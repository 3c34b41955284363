package com.example.userimport.ingestion.support;

import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;
import lombok.extern.slf4j.Slf4j;
import org.apache.camel.dataformat.univocity.UniVocityCsvDataFormat;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class CamelCsvParserFactory extends UniVocityCsvDataFormat {

    static final int MAX_CHARS_PER_COLUMN = 4096;

    public CsvParser newParser() {
        CsvParserSettings settings = createParserSettings();
        settings.setHeaderExtractionEnabled(false);
        settings.setSkipEmptyLines(true);
        settings.setIgnoreLeadingWhitespaces(true);
        settings.setIgnoreTrailingWhitespaces(true);
        settings.setMaxCharsPerColumn(MAX_CHARS_PER_COLUMN);
        settings.setLineSeparatorDetectionEnabled(true);
        settings.setNullValue("");
        settings.setEmptyValue("");
        settings.getFormat().setQuote('"');
        settings.getFormat().setQuoteEscape('"');
        log.debug("Created CsvParser with maxCharsPerColumn={}", settings.getMaxCharsPerColumn());
        return createParser(settings);
    }
}
