package com.dcruver.vaultdrift.config;

import com.dcruver.vaultdrift.domain.EmbeddingUnavailableException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Retry policy for embedding provider calls.
 *
 * Only provider failures are retried. Timeouts and malformed input fail on the first attempt.
 */
@Configuration
@Slf4j
public class ResilienceConfiguration {

    public static final String EMBEDDING_RETRY = "embeddingProvider";

    @Bean
    public RetryRegistry retryRegistry(EngineProperties properties) {
        RetryRegistry registry = RetryRegistry.of(embeddingRetryConfig(properties.getEmbedding()));
        registry.retry(EMBEDDING_RETRY);
        return registry;
    }

    @Bean
    public Retry embeddingRetry(RetryRegistry registry) {
        Retry retry = registry.retry(EMBEDDING_RETRY);
        retry.getEventPublisher().onRetry(event ->
            log.warn("Retrying embedding call (attempt {}): {}",
                event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
        return retry;
    }

    public static RetryConfig embeddingRetryConfig(EngineProperties.Embedding embedding) {
        return RetryConfig.custom()
            .maxAttempts(Math.max(1, embedding.getMaxAttempts()))
            .waitDuration(embedding.getRetryWait())
            .retryOnException(e -> e instanceof EmbeddingUnavailableException
                && ((EmbeddingUnavailableException) e).isRetryable())
            .build();
    }

    /**
     * Standalone retry for code that runs outside the application context.
     */
    public static Retry embeddingRetry(EngineProperties.Embedding embedding) {
        return Retry.of(EMBEDDING_RETRY, embeddingRetryConfig(embedding));
    }
}
