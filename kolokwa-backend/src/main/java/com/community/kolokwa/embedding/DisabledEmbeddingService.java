package com.community.kolokwa.embedding;

/**
 * Default when no embedding model is configured. Never asked to embed.
 */
public class DisabledEmbeddingService implements EmbeddingService {

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public float[] embed(String text) {
        throw new UnsupportedOperationException("Embedding is disabled");
    }

    @Override
    public String modelName() {
        return "disabled";
    }
}
