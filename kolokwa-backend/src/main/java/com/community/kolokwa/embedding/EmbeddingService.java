package com.community.kolokwa.embedding;

/**
 * Turns entry text into a vector for semantic search.
 */
public interface EmbeddingService {

    boolean isAvailable();

    /**
     * @throws RuntimeException when the backing model fails
     */
    float[] embed(String text);

    default String modelName() {
        return getClass().getSimpleName();
    }
}
