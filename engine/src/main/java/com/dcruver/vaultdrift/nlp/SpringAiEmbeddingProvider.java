package com.dcruver.vaultdrift.nlp;

import com.dcruver.vaultdrift.domain.EmbeddingUnavailableException;
import com.dcruver.vaultdrift.domain.EmbeddingUnavailableException.Reason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Embedding provider backed by a Spring AI {@link EmbeddingModel} (Ollama by default).
 */
@Service
@Slf4j
@ConditionalOnProperty(prefix = "vaultdrift.embedding", name = "provider", havingValue = "ollama", matchIfMissing = true)
public class SpringAiEmbeddingProvider implements EmbeddingProvider {

    private final EmbeddingModel embeddingModel;
    private final String modelName;

    public SpringAiEmbeddingProvider(
        EmbeddingModel embeddingModel,
        @Value("${spring.ai.ollama.embedding.options.model:nomic-embed-text:latest}") String modelName
    ) {
        this.embeddingModel = embeddingModel;
        this.modelName = modelName;
        log.info("SpringAiEmbeddingProvider initialized with EmbeddingModel: {}", embeddingModel.getClass().getSimpleName());
    }

    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingUnavailableException(Reason.MALFORMED_INPUT, "Cannot generate embedding for empty text");
        }

        EmbeddingResponse response;
        try {
            response = embeddingModel.embedForResponse(List.of(text));
        } catch (RuntimeException e) {
            throw new EmbeddingUnavailableException(Reason.PROVIDER_FAILURE,
                "Embedding model call failed: " + e.getMessage(), e);
        }
        if (response == null || response.getResults().isEmpty() || response.getResults().get(0).getOutput() == null) {
            throw new EmbeddingUnavailableException(Reason.MALFORMED_INPUT, "No embedding generated for text");
        }
        return response.getResults().get(0).getOutput();
    }

    @Override
    public String modelName() {
        return modelName;
    }
}
