package com.example.userimport.ingestion.cli;

import com.example.userimport.ingestion.support.ImportError;
import com.example.userimport.ingestion.support.ImportErrorCode;
import com.example.userimport.ingestion.support.ImportProcessingException;
import com.example.userimport.ingestion.support.UserCsvReader;
import java.util.List;

/**
 * Parsed command-line options.
 *
 * @param source         file path, or {@code "-"} for standard input
 * @param idempotencyKey may be null
 * @param failFast       null when {@code --fail-fast} was not given, so the configured default applies
 */
public record ImportCommandLine(String source, String idempotencyKey, Boolean failFast) {

    public static ImportCommandLine parse(List<String> args) {
        String source = UserCsvReader.STDIN_SOURCE;
        String idempotencyKey = null;
        Boolean failFast = null;

        int index = 0;
        while (index < args.size()) {
            String arg = args.get(index);
            switch (arg) {
                case "--source", "-s" -> {
                    source = valueAfter(args, index, arg);
                    index += 2;
                }
                case "--idempotency", "-i" -> {
                    idempotencyKey = valueAfter(args, index, arg);
                    index += 2;
                }
                case "--fail-fast" -> {
                    failFast = Boolean.TRUE;
                    index++;
                }
                default -> throw new ImportProcessingException(
                        ImportError.config(ImportErrorCode.CONFIG_INVALID, "Unknown CLI argument: " + arg));
            }
        }
        return new ImportCommandLine(source, idempotencyKey, failFast);
    }

    private static String valueAfter(List<String> args, int index, String flag) {
        if (index + 1 >= args.size()) {
            throw new ImportProcessingException(
                    ImportError.config(ImportErrorCode.CONFIG_MISSING, "Missing value for " + flag));
        }
        return args.get(index + 1);
    }
}
