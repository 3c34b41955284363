package com.example.userimport.ingestion.repository;

import com.example.userimport.ingestion.model.BulkUpsertResult;
import com.example.userimport.ingestion.model.User;
import java.util.List;
import java.util.Optional;

public interface UserRepository {

    Optional<User> findById(String id);

    /**
     * Case-insensitive lookup by email. When several users share the address, the earliest indexed one wins.
     */
    Optional<User> findByEmail(String email);

    /**
     * Writes {@code user}, unless {@code idempotencyKey} is live and already covers {@code user.id()}, in which
     * case the stored user is returned and nothing is written.
     *
     * @param idempotencyKey replay scope, may be null
     */
    User upsert(User user, String idempotencyKey);

    default User upsert(User user) {
        return upsert(user, null);
    }

    BulkUpsertResult bulkUpsert(List<User> users, BulkUpsertOptions options);
}
