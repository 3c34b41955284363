package com.example.userimport.ingestion.repository;

import com.example.userimport.ingestion.model.BulkUpsertFailure;
import com.example.userimport.ingestion.model.BulkUpsertResult;
import com.example.userimport.ingestion.model.User;
import com.example.userimport.ingestion.support.ImportError;
import com.example.userimport.ingestion.support.ImportErrorCode;
import com.example.userimport.ingestion.support.ImportProcessingException;
import com.example.userimport.ingestion.support.RetryContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class InMemoryUserRepository implements UserRepository {

    static final String UPSERT_OPERATION = "repo.upsert";

    private final Map<String, User> byId = new HashMap<>();
    private final Map<String, Set<String>> idsByEmail = new HashMap<>();
    private final Map<String, IdempotencyEntry> idempotency = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Duration idempotencyTtl;
    private final Clock clock;

    public InMemoryUserRepository(Duration idempotencyTtl, Clock clock) {
        this.idempotencyTtl = idempotencyTtl == null || idempotencyTtl.isNegative() ? Duration.ZERO : idempotencyTtl;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Optional<User> findById(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(byId.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<User> findByEmail(String email) {
        String key = User.normalizeEmail(email);
        lock.readLock().lock();
        try {
            Set<String> ids = idsByEmail.getOrDefault(key, Set.of());
            return ids.stream().findFirst().map(byId::get);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return byId.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public User upsert(User user, String idempotencyKey) {
        Objects.requireNonNull(user, "user");
        // replay check and write share the write lock
        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            IdempotencyEntry entry = idempotencyKey == null ? null : idempotency.get(idempotencyKey);
            User cached = entry != null && entry.covers(user.id(), now) ? byId.get(user.id()) : null;
            if (cached != null) {
                log.debug("Idempotent replay detected; returning cached user idempotencyKey={} userId={}",
                        idempotencyKey, user.id());
                return cached;
            }
            return persistFresh(user, idempotencyKey, now);
        } catch (ImportProcessingException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new ImportProcessingException(ImportError.repo(
                    ImportErrorCode.REPO_WRITE_FAILED,
                    "Failed to persist user",
                    Map.of("id", user.id()),
                    ex));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public BulkUpsertResult bulkUpsert(List<User> users, BulkUpsertOptions options) {
        if (users.isEmpty()) {
            return BulkUpsertResult.EMPTY;
        }
        RetryContext context = new RetryContext(UPSERT_OPERATION, options.spanId());
        return options.failFast()
                ? sequentialUpsert(users, options, context)
                : concurrentUpsert(users, options, context);
    }

    private BulkUpsertResult sequentialUpsert(List<User> users, BulkUpsertOptions options, RetryContext context) {
        List<User> stored = new ArrayList<>(users.size());
        for (User user : users) {
            stored.add(options.retryExecutor().execute(
                    attempt -> upsert(user, options.idempotencyKey()), context));
        }
        log.info("Sequential bulk upsert completed count={}", stored.size());
        return new BulkUpsertResult(stored, List.of());
    }

    private BulkUpsertResult concurrentUpsert(List<User> users, BulkUpsertOptions options, RetryContext context) {
        List<CompletableFuture<WriteOutcome>> futures = new ArrayList<>(users.size());
        for (User user : users) {
            CompletableFuture<WriteOutcome> future = options.rateLimiter()
                    .submit(() -> options.retryExecutor().execute(
                            attempt -> upsert(user, options.idempotencyKey()), context))
                    .handle((stored, failure) -> failure == null
                            ? WriteOutcome.stored(stored)
                            : WriteOutcome.failed(user, ImportProcessingException.errorOf(unwrap(failure))));
            futures.add(future);
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();

        List<User> successes = new ArrayList<>();
        List<BulkUpsertFailure> failures = new ArrayList<>();
        for (CompletableFuture<WriteOutcome> future : futures) {
            WriteOutcome outcome = future.join();
            if (outcome.failure() == null) {
                successes.add(outcome.stored());
            } else {
                failures.add(outcome.failure());
            }
        }
        log.info("Concurrent bulk upsert completed succeeded={} failed={}", successes.size(), failures.size());
        return new BulkUpsertResult(successes, failures);
    }

    private User persistFresh(User user, String idempotencyKey, Instant now) {
        User stored = user.withNormalizedEmail();
        User previous = byId.put(stored.id(), stored);
        if (previous != null && !previous.email().equals(stored.email())) {
            unindexEmail(previous);
        }
        idsByEmail.computeIfAbsent(stored.email(), email -> new LinkedHashSet<>()).add(stored.id());
        if (idempotencyKey != null) {
            registerIdempotency(idempotencyKey, stored.id(), now);
        }
        return stored;
    }

    private void unindexEmail(User previous) {
        Set<String> ids = idsByEmail.get(previous.email());
        if (ids != null) {
            ids.remove(previous.id());
            if (ids.isEmpty()) {
                idsByEmail.remove(previous.email());
            }
        }
    }

    private void registerIdempotency(String key, String userId, Instant now) {
        IdempotencyEntry existing = idempotency.get(key);
        if (existing != null && existing.isLive(now)) {
            existing.memberIds().add(userId);
            return;
        }
        Set<String> members = new HashSet<>();
        members.add(userId);
        idempotency.put(key, new IdempotencyEntry(now.plus(idempotencyTtl), members));
    }

    private static Throwable unwrap(Throwable failure) {
        return failure instanceof CompletionException && failure.getCause() != null ? failure.getCause() : failure;
    }

    private record WriteOutcome(User stored, BulkUpsertFailure failure) {

        static WriteOutcome stored(User user) {
            return new WriteOutcome(user, null);
        }

        static WriteOutcome failed(User user, ImportError error) {
            return new WriteOutcome(null, new BulkUpsertFailure(user, error));
        }
    }
}
