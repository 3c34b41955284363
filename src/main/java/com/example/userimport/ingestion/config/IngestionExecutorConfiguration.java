package com.example.userimport.ingestion.config;

import com.example.userimport.ingestion.support.RateLimiter;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Slf4j
@Configuration
public class IngestionExecutorConfiguration {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService ingestionExecutor(IngestionProperties properties) {
        int threads = Math.max(1, properties.concurrency());
        log.info("Creating ingestion executor threads={}", threads);
        return Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("ingestion-"));
    }

    @Bean
    public RateLimiter persistenceRateLimiter(IngestionProperties properties, ExecutorService ingestionExecutor) {
        return new RateLimiter(properties.concurrency(), ingestionExecutor);
    }
}
