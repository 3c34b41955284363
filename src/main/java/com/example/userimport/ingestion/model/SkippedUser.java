package com.example.userimport.ingestion.model;

import com.example.userimport.ingestion.support.ImportError;

public record SkippedUser(User user, ImportError error) {

    public static SkippedUser from(PolicyOutcome.Skip skip) {
        return new SkippedUser(skip.user(), skip.error());
    }
}
