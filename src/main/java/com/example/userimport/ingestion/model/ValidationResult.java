package com.example.userimport.ingestion.model;

import java.util.List;

public record ValidationResult(User user, List<ValidationIssue> issues) {

    public ValidationResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public static ValidationResult valid(User user) {
        return new ValidationResult(user, List.of());
    }

    public static ValidationResult invalid(List<ValidationIssue> issues) {
        return new ValidationResult(null, issues);
    }

    public boolean isValid() {
        return user != null && issues.isEmpty();
    }
}
