package com.example.userimport.ingestion.support;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class CompressionSupport {

    private static final int SIGNATURE_LENGTH = 2;
    private static final int BUFFER_SIZE = 64 * 1024;

    public Reader openReader(InputStream original, String sourceName) throws IOException {
        return new InputStreamReader(decodeIfNecessary(original, sourceName), StandardCharsets.UTF_8);
    }

    InputStream decodeIfNecessary(InputStream original, String sourceName) throws IOException {
        BufferedInputStream buffered = new BufferedInputStream(original, BUFFER_SIZE);
        if (isGzipStream(buffered)) {
            log.debug("Detected gzip content for source={}", sourceName);
            return new GzipCompressorInputStream(buffered, true);
        }
        if (hasGzipSuffix(sourceName)) {
            log.warn("Source={} is named like a gzip file but is not compressed; reading as plain text", sourceName);
        }
        return buffered;
    }

    private static boolean isGzipStream(BufferedInputStream stream) throws IOException {
        stream.mark(SIGNATURE_LENGTH);
        byte[] signature = stream.readNBytes(SIGNATURE_LENGTH);
        stream.reset();
        return GzipCompressorInputStream.matches(signature, signature.length);
    }

    private static boolean hasGzipSuffix(String sourceName) {
        return sourceName != null && sourceName.toLowerCase(Locale.ROOT).endsWith(".gz");
    }
}
