package com.example.userimport.ingestion.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.userimport.ingestion.model.ValidationIssue;
import com.example.userimport.ingestion.model.ValidationResult;
import com.example.userimport.ingestion.support.ImportError;
import com.example.userimport.ingestion.support.ImportErrorCode;
import com.example.userimport.ingestion.support.ImportErrorType;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class UserRecordValidatorTest {

    private final UserRecordValidator validator = new UserRecordValidator();

    @Test
    void validRecordBecomesUserWithNormalizedEmail() {
        ValidationResult result = validator.validate(raw("1", " Ada ", " Ada@Example.COM ", "36",
                "2024-01-01T10:15:30.000Z"));

        assertThat(result.isValid()).isTrue();
        assertThat(result.user().id()).isEqualTo("1");
        assertThat(result.user().name()).isEqualTo("Ada");
        assertThat(result.user().email()).isEqualTo("ada@example.com");
        assertThat(result.user().age()).isEqualTo(36);
        assertThat(result.user().updatedAt()).isEqualTo(Instant.parse("2024-01-01T10:15:30Z"));
    }

    @ParameterizedTest
    @CsvSource({
            "2024-01-01T10:15:30Z, 2024-01-01T10:15:30Z",
            "2024-01-01T12:15:30+02:00, 2024-01-01T10:15:30Z",
            "2024-01-01T10:15:30, 2024-01-01T10:15:30Z",
            "2024-01-01, 2024-01-01T00:00:00Z"
    })
    void acceptsIsoTimestampVariants(String value, String expected) {
        ValidationResult result = validator.validate(raw("1", "Ada", "ada@example.com", "36", value));

        assertThat(result.isValid()).isTrue();
        assertThat(result.user().updatedAt()).isEqualTo(Instant.parse(expected));
    }

    @ParameterizedTest
    @ValueSource(strings = {"yesterday", "2024-13-01", "01/02/2024", "2024-01-01 10:15"})
    void rejectsNonIsoTimestamps(String value) {
        ValidationResult result = validator.validate(raw("1", "Ada", "ada@example.com", "36", value));

        assertThat(result.issues()).containsExactly(
                new ValidationIssue("updatedAt", "updatedAt must be a valid ISO8601 timestamp"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"ada", "ada@example", "ada @example.com", "@example.com", ""})
    void rejectsMalformedEmails(String email) {
        ValidationResult result = validator.validate(raw("1", "Ada", email, "36", "2024-01-01"));

        assertThat(result.issues()).extracting(ValidationIssue::path).containsExactly("email");
    }

    @ParameterizedTest
    @CsvSource({
            "abc, age must be an integer",
            "36.5, age must be an integer",
            "-1, age must be between 0 and 130",
            "131, age must be between 0 and 130"
    })
    void rejectsBadAges(String age, String message) {
        ValidationResult result = validator.validate(raw("1", "Ada", "ada@example.com", age, "2024-01-01"));

        assertThat(result.issues()).containsExactly(new ValidationIssue("age", message));
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "130"})
    void acceptsAgeBounds(String age) {
        assertThat(validator.validate(raw("1", "Ada", "ada@example.com", age, "2024-01-01")).isValid()).isTrue();
    }

    @Test
    void reportsEveryIssueOfARecord() {
        Map<String, String> raw = new HashMap<>();
        raw.put("email", "not-an-email");

        ValidationResult result = validator.validate(raw);

        assertThat(result.isValid()).isFalse();
        assertThat(result.user()).isNull();
        assertThat(result.issues()).extracting(ValidationIssue::path)
                .containsExactly("id", "name", "email", "age", "updatedAt");
    }

    @Test
    void toErrorListsIssuesInDetails() {
        ValidationResult result = validator.validate(raw("", "Ada", "ada@example.com", "36", "2024-01-01"));

        ImportError error = UserRecordValidator.toError(result);

        assertThat(error.type()).isEqualTo(ImportErrorType.VALIDATION_ERROR);
        assertThat(error.code()).isEqualTo(ImportErrorCode.VALIDATION_FAILED);
        assertThat(error.message()).isEqualTo("User validation failed");
        assertThat(error.details()).containsEntry("issues",
                List.of(Map.of("path", "id", "message", "id is required")));
    }

    static Map<String, String> raw(String id, String name, String email, String age, String updatedAt) {
        Map<String, String> raw = new HashMap<>();
        raw.put("id", id);
        raw.put("name", name);
        raw.put("email", email);
        raw.put("age", age);
        raw.put("updatedAt", updatedAt);
        return raw;
    }
}
