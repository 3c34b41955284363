package com.example.userimport.ingestion.model;

public record ValidationIssue(String path, String message) {
}
