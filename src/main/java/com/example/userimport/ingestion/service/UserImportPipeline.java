package com.example.userimport.ingestion.service;

import com.example.userimport.ingestion.config.IngestionProperties;
import com.example.userimport.ingestion.model.BulkUpsertResult;
import com.example.userimport.ingestion.model.PipelineErrorRecord;
import com.example.userimport.ingestion.model.PipelineOutput;
import com.example.userimport.ingestion.model.PipelineRequest;
import com.example.userimport.ingestion.model.PipelineStage;
import com.example.userimport.ingestion.model.PipelineStats;
import com.example.userimport.ingestion.model.PolicyOutcome;
import com.example.userimport.ingestion.model.SkippedUser;
import com.example.userimport.ingestion.model.User;
import com.example.userimport.ingestion.model.ValidationResult;
import com.example.userimport.ingestion.repository.BulkUpsertOptions;
import com.example.userimport.ingestion.repository.UserRepository;
import com.example.userimport.ingestion.support.ImportError;
import com.example.userimport.ingestion.support.ImportProcessingException;
import com.example.userimport.ingestion.support.RateLimiter;
import com.example.userimport.ingestion.support.RetryExecutor;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserImportPipeline {

    static final String SPAN_ID_KEY = "spanId";

    private final IngestionProperties properties;
    private final UserRecordValidator validator;
    private final UserPolicyEvaluator policyEvaluator;
    private final UserRepository repository;
    private final RateLimiter rateLimiter;
    private final RetryExecutor retryExecutor;
    private final ImportReportBuilder reportBuilder;

    /**
     * @throws ImportProcessingException when a record fails validation in fail-fast mode, the source fails, or a
     *                                   write fails while bulk fail-fast is enabled
     */
    public PipelineOutput run(PipelineRequest request) {
        String spanId = request.spanId() != null ? request.spanId() : UUID.randomUUID().toString();
        boolean failFast = request.failFast() != null ? request.failFast() : properties.failFast();
        String previousSpanId = MDC.get(SPAN_ID_KEY);
        MDC.put(SPAN_ID_KEY, spanId);
        Instant start = Instant.now();
        try {
            log.info("Pipeline start spanId={} failFast={} bulkFailFast={} idempotencyKey={}",
                    spanId, failFast, properties.bulkFailFast(), request.idempotencyKey());
            PipelineAccumulator accumulator = accumulate(request.source(), failFast);
            log.info("Validation and policy phase completed spanId={} total={} valid={} skipped={} invalid={}",
                    spanId, accumulator.total, accumulator.validUsers.size(), accumulator.skipped.size(),
                    accumulator.validationErrors.size());

            enter(PipelineStage.PERSISTING);
            BulkUpsertResult bulk = repository.bulkUpsert(accumulator.validUsers, new BulkUpsertOptions(
                    request.idempotencyKey(), rateLimiter, retryExecutor, properties.bulkFailFast(), spanId));

            enter(PipelineStage.REPORTING);
            PipelineOutput output = toOutput(accumulator, bulk);
            log.info("Pipeline completed spanId={} total={} validated={} persisted={} skipped={} failed={} durationMs={}",
                    spanId, output.stats().total(), output.stats().validated(), output.stats().persisted(),
                    output.stats().skipped(), output.stats().failed(),
                    Duration.between(start, Instant.now()).toMillis());
            enter(PipelineStage.DONE);
            return output;
        } catch (RuntimeException ex) {
            ImportProcessingException failure = ImportProcessingException.wrap(ex);
            log.error("Pipeline failed spanId={} type={} code={}: {}",
                    spanId, failure.getType(), failure.getCode(), failure.getMessage());
            throw failure;
        } finally {
            if (previousSpanId != null) {
                MDC.put(SPAN_ID_KEY, previousSpanId);
            } else {
                MDC.remove(SPAN_ID_KEY);
            }
        }
    }

    private PipelineAccumulator accumulate(Iterator<Map<String, String>> source, boolean failFast) {
        enter(PipelineStage.STREAMING);
        PipelineAccumulator accumulator = new PipelineAccumulator(properties.progressLogInterval());
        enter(PipelineStage.ACCUMULATING);
        while (source.hasNext()) {
            Map<String, String> raw = source.next();
            accumulator.incrementTotal();

            ValidationResult validation = validator.validate(raw);
            if (!validation.isValid()) {
                ImportError error = UserRecordValidator.toError(validation);
                log.warn("Record failed validation record={} code={} issues={}",
                        accumulator.total, error.code(), validation.issues().size());
                if (failFast) {
                    throw new ImportProcessingException(error);
                }
                accumulator.recordValidationError(PipelineErrorRecord.validation(error, raw));
                continue;
            }

            PolicyOutcome decision = policyEvaluator.evaluate(validation.user());
            if (decision instanceof PolicyOutcome.Skip skip) {
                log.info("User skipped by policy stage=policy code={} userId={}",
                        skip.error().code(), skip.user().id());
                accumulator.recordSkip(SkippedUser.from(skip));
            } else {
                accumulator.recordAccepted(decision.user());
            }
        }
        return accumulator;
    }

    private PipelineOutput toOutput(PipelineAccumulator accumulator, BulkUpsertResult bulk) {
        List<PipelineErrorRecord> errors = Stream.concat(
                        accumulator.validationErrors.stream(),
                        bulk.failures().stream().map(PipelineErrorRecord::persistence))
                .toList();
        PipelineStats stats = PipelineStats.derive(
                accumulator.total, accumulator.validationErrors.size(), accumulator.skipped.size(), bulk);
        String report = reportBuilder.build(accumulator.total, bulk.successes(), accumulator.skipped, errors);
        return new PipelineOutput(report, stats, errors, accumulator.skipped, bulk.successes());
    }

    private static void enter(PipelineStage stage) {
        log.debug("Pipeline stage={}", stage);
    }

    private static final class PipelineAccumulator {
        private final long interval;
        private final List<User> validUsers = new ArrayList<>();
        private final List<SkippedUser> skipped = new ArrayList<>();
        private final List<PipelineErrorRecord> validationErrors = new ArrayList<>();

        private long total;
        private long nextReportThreshold;

        private PipelineAccumulator(long interval) {
            this.interval = interval;
            this.nextReportThreshold = interval;
        }

        void incrementTotal() {
            total++;
            if (total >= nextReportThreshold) {
                log.info("Import progress processed={} accepted={} skipped={} invalid={}",
                        total, validUsers.size(), skipped.size(), validationErrors.size());
                nextReportThreshold = total + interval;
            }
        }

        void recordAccepted(User user) {
            validUsers.add(user);
        }

        void recordSkip(SkippedUser skip) {
            skipped.add(skip);
        }

        void recordValidationError(PipelineErrorRecord error) {
            validationErrors.add(error);
        }
    }
}
