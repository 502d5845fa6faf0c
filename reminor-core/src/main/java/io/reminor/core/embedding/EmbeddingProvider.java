package io.reminor.core.embedding;

import java.io.IOException;

/**
 * Maps text to a dense vector of fixed dimensionality.
 */
public interface EmbeddingProvider {
    String name();

    float[] embed(String text) throws IOException;
}
