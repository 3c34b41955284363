package com.example.userimport.ingestion.model;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

public record User(String id, String name, String email, int age, Instant updatedAt) {

    public static final int MIN_AGE = 0;
    public static final int MAX_AGE = 130;

    public User {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(email, "email");
        Objects.requireNonNull(updatedAt, "updatedAt");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (age < MIN_AGE || age > MAX_AGE) {
            throw new IllegalArgumentException("age must be between %d and %d".formatted(MIN_AGE, MAX_AGE));
        }
    }

    public User withNormalizedEmail() {
        String normalized = normalizeEmail(email);
        return normalized.equals(email) ? this : new User(id, name, normalized, age, updatedAt);
    }

    /**
     * Part after the last {@code @}, or {@code "unknown"} when there is none.
     */
    public String emailDomain() {
        int at = email.lastIndexOf('@');
        return at < 0 || at == email.length() - 1 ? "unknown" : email.substring(at + 1);
    }

    public static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }
}
