package com.example.userimport.ingestion.model;

import com.example.userimport.ingestion.support.ImportError;

public record BulkUpsertFailure(User user, ImportError error) {
}
