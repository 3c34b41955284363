package com.example.userimport.ingestion.config;

import com.example.userimport.ingestion.repository.InMemoryUserRepository;
import com.example.userimport.ingestion.support.RetryExecutor;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class IngestionConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetryExecutor retryExecutor(IngestionProperties properties) {
        log.info("Configuring retry maxAttempts={} baseDelay={} maxDelay={} factor={}",
                properties.retry().maxAttempts(), properties.retry().baseDelay(),
                properties.retry().maxDelay(), properties.retry().factor());
        return new RetryExecutor(properties.retry().toPolicy());
    }

    @Bean
    public InMemoryUserRepository userRepository(IngestionProperties properties, Clock clock) {
        return new InMemoryUserRepository(properties.idempotencyTtl(), clock);
    }
}
