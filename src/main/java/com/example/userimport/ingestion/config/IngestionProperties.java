package com.example.userimport.ingestion.config;

import com.example.userimport.ingestion.support.RetryPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "app.ingestion")
@Validated
public record IngestionProperties(
        @DefaultValue("4") @Positive int concurrency,
        @DefaultValue("false") boolean failFast,
        @DefaultValue("true") boolean bulkFailFast,
        @DefaultValue("10m") @NotNull Duration idempotencyTtl,
        @DefaultValue @NotNull @Valid Retry retry,
        @DefaultValue("5") @Positive int reportTopDomains,
        @DefaultValue("1000") @Positive int progressLogInterval,
        @DefaultValue({"mailinator.com", "trashmail.com", "10minutemail.com", "tempmail.com"})
        List<String> disposableDomains) {

    public static final List<String> DEFAULT_DISPOSABLE_DOMAINS =
            List.of("mailinator.com", "trashmail.com", "10minutemail.com", "tempmail.com");

    public IngestionProperties {
        disposableDomains = disposableDomains == null ? List.of() : List.copyOf(disposableDomains);
    }

    public static IngestionProperties defaults() {
        return new IngestionProperties(4, false, true, Duration.ofMinutes(10), Retry.defaults(), 5, 1000,
                DEFAULT_DISPOSABLE_DOMAINS);
    }

    @AssertTrue(message = "app.ingestion.idempotency-ttl must not be negative")
    public boolean isIdempotencyTtlNonNegative() {
        return idempotencyTtl == null || !idempotencyTtl.isNegative();
    }

    public record Retry(
            @DefaultValue("3") @Min(1) int maxAttempts,
            @DefaultValue("100ms") @NotNull Duration baseDelay,
            @DefaultValue("3s") @NotNull Duration maxDelay,
            @DefaultValue("2.0") @DecimalMin("1.0") double factor) {

        public static Retry defaults() {
            return new Retry(3, Duration.ofMillis(100), Duration.ofSeconds(3), 2.0d);
        }

        @AssertTrue(message = "app.ingestion.retry delays must not be negative")
        public boolean isDelayNonNegative() {
            return (baseDelay == null || !baseDelay.isNegative()) && (maxDelay == null || !maxDelay.isNegative());
        }

        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxAttempts, baseDelay, maxDelay, factor);
        }
    }
}
