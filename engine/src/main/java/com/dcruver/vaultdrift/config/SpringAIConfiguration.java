package com.dcruver.vaultdrift.config;

import io.micrometer.observation.ObservationRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.ollama.OllamaEmbeddingModel;
import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.ai.ollama.management.ModelManagementOptions;
import org.springframework.ai.ollama.management.PullModelStrategy;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Ollama-backed EmbeddingModel for the semantic cache.
 *
 * Only active with the ollama embedding provider; the offline hashing provider needs no model server.
 */
@Configuration
@Slf4j
@ConditionalOnProperty(prefix = "vaultdrift.embedding", name = "provider", havingValue = "ollama", matchIfMissing = true)
public class SpringAIConfiguration {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);

    @Value("${spring.ai.ollama.base-url:http://localhost:11434}")
    private String ollamaBaseUrl;

    @Value("${spring.ai.ollama.embedding.options.model:nomic-embed-text:latest}")
    private String embeddingModelName;

    /**
     * HTTP read timeout equals the per-call embedding timeout.
     */
    @Bean
    public OllamaApi ollamaApi(EngineProperties properties) {
        Duration readTimeout = properties.getEmbedding().getTimeout();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(CONNECT_TIMEOUT);
        requestFactory.setReadTimeout(readTimeout);

        log.info("Connecting to Ollama at {} (read timeout {} ms)", ollamaBaseUrl, readTimeout.toMillis());
        return OllamaApi.builder()
                .baseUrl(ollamaBaseUrl)
                .restClientBuilder(RestClient.builder().requestFactory(requestFactory))
                .build();
    }

    @Bean
    public EmbeddingModel embeddingModel(OllamaApi ollamaApi, ObjectProvider<ObservationRegistry> observationRegistry) {
        OllamaOptions options = OllamaOptions.builder()
                .model(embeddingModelName)
                .build();

        // The model must already be pulled; a missing model fails the first call
        ModelManagementOptions management = ModelManagementOptions.builder()
                .pullModelStrategy(PullModelStrategy.NEVER)
                .build();

        ObservationRegistry registry = observationRegistry.getIfAvailable(() -> ObservationRegistry.NOOP);
        log.info("Embedding notes with Ollama model {}", embeddingModelName);
        return new OllamaEmbeddingModel(ollamaApi, options, registry, management);
    }
}
