package com.example.userimport.ingestion.service;

import com.example.userimport.ingestion.model.User;
import com.example.userimport.ingestion.model.ValidationIssue;
import com.example.userimport.ingestion.model.ValidationResult;
import com.example.userimport.ingestion.support.ImportError;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class UserRecordValidator {

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    // date, optionally followed by a time, optionally followed by an offset or Z
    private static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter(Locale.ROOT);

    public ValidationResult validate(Map<String, String> raw) {
        List<ValidationIssue> issues = new ArrayList<>();

        String id = field(raw, "id");
        if (id.isEmpty()) {
            issues.add(new ValidationIssue("id", "id is required"));
        }

        String name = field(raw, "name");
        if (name.isEmpty()) {
            issues.add(new ValidationIssue("name", "name is required"));
        }

        String email = User.normalizeEmail(field(raw, "email"));
        if (!EMAIL_PATTERN.matcher(email).matches()) {
            issues.add(new ValidationIssue("email", "invalid email format"));
        }

        Integer age = parseAge(field(raw, "age"), issues);
        Instant updatedAt = parseTimestamp(field(raw, "updatedAt"));
        if (updatedAt == null) {
            issues.add(new ValidationIssue("updatedAt", "updatedAt must be a valid ISO8601 timestamp"));
        }

        if (!issues.isEmpty()) {
            return ValidationResult.invalid(issues);
        }
        return ValidationResult.valid(new User(id, name, email, age, updatedAt));
    }

    public static ImportError toError(ValidationResult result) {
        List<Map<String, String>> issues = result.issues().stream()
                .map(issue -> Map.of("path", issue.path(), "message", issue.message()))
                .toList();
        return ImportError.validation("User validation failed", Map.of("issues", issues));
    }

    private static Integer parseAge(String value, List<ValidationIssue> issues) {
        int age;
        try {
            age = Integer.parseInt(value);
        } catch (NumberFormatException ex) {
            issues.add(new ValidationIssue("age", "age must be an integer"));
            return null;
        }
        if (age < User.MIN_AGE || age > User.MAX_AGE) {
            issues.add(new ValidationIssue("age", "age must be between 0 and 130"));
            return null;
        }
        return age;
    }

    private static Instant parseTimestamp(String value) {
        if (value.isEmpty()) {
            return null;
        }
        try {
            TemporalAccessor parsed = TIMESTAMP_FORMAT.parseBest(value,
                    OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime.toInstant();
            }
            if (parsed instanceof LocalDateTime localDateTime) {
                return localDateTime.toInstant(ZoneOffset.UTC);
            }
            return ((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    private static String field(Map<String, String> raw, String name) {
        String value = raw == null ? null : raw.get(name);
        return value == null ? "" : value.trim();
    }
}
