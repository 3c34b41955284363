package com.example.userimport.ingestion.model;

import com.example.userimport.ingestion.support.ImportError;

public sealed interface PolicyOutcome permits PolicyOutcome.Accept, PolicyOutcome.Skip {

    User user();

    static PolicyOutcome accept(User user) {
        return new Accept(user);
    }

    static PolicyOutcome skip(User user, PolicySkipReason reason, ImportError error) {
        return new Skip(user, reason, error);
    }

    record Accept(User user) implements PolicyOutcome {
    }

    record Skip(User user, PolicySkipReason reason, ImportError error) implements PolicyOutcome {
    }
}
