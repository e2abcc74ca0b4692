package com.dcruver.vaultdrift.nlp;

import com.dcruver.vaultdrift.config.EngineProperties;
import com.dcruver.vaultdrift.domain.EmbeddingUnavailableException;
import com.dcruver.vaultdrift.domain.EmbeddingUnavailableException.Reason;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Offline provider: counts tokens into hashed buckets. Deterministic and dependency free,
 * useful without a running model server.
 */
@Service
@ConditionalOnProperty(prefix = "vaultdrift.embedding", name = "provider", havingValue = "hashing")
public class HashingEmbeddingProvider implements EmbeddingProvider {

    private final int dimension;

    @Autowired
    public HashingEmbeddingProvider(EngineProperties properties) {
        this(properties.getEmbedding().getHashingDimension());
    }

    public HashingEmbeddingProvider(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        if (text == null) {
            throw new EmbeddingUnavailableException(Reason.MALFORMED_INPUT, "Cannot embed null text");
        }
        float[] vector = new float[dimension];
        String[] tokens = text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+");
        boolean any = false;
        for (String token : tokens) {
            if (token.isEmpty()) {
                continue;
            }
            vector[Math.floorMod(token.hashCode(), dimension)] += 1.0f;
            // second bucket with a sign keeps unrelated texts from colliding completely
            vector[Math.floorMod(token.hashCode() * 31 + 7, dimension)] += token.length() % 2 == 0 ? 0.5f : -0.5f;
            any = true;
        }
        if (!any) {
            // every empty note maps to the same point
            vector[0] = 1.0f;
        }
        return vector;
    }

    @Override
    public String modelName() {
        return "hashing-" + dimension;
    }
}
