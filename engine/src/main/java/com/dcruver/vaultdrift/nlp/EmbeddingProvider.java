package com.dcruver.vaultdrift.nlp;

/**
 * Turns text into a fixed-width semantic vector. May block and may fail.
 */
public interface EmbeddingProvider {

    /**
     * @throws com.dcruver.vaultdrift.domain.EmbeddingUnavailableException when no vector can be produced
     */
    float[] embed(String text);

    /**
     * Identifies the model, so vectors from different models never share a cache entry.
     */
    String modelName();
}
