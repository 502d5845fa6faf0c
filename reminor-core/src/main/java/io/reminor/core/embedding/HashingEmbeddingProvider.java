package io.reminor.core.embedding;

import io.reminor.core.text.TextTokens;

/**
 * Offline bag-of-words embedding: each keyword is hashed into one of {@code dimension}
 * buckets and the resulting vector is L2-normalized.
 */
public final class HashingEmbeddingProvider implements EmbeddingProvider {
    private final int dimension;

    public HashingEmbeddingProvider(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
    }

    @Override
    public String name() {
        return "hashing-" + dimension;
    }

    @Override
    public float[] embed(String text) {
        double[] vector = new double[dimension];
        for (String token : TextTokens.keywords(text, 2)) {
            int index = Math.floorMod(token.hashCode(), dimension);
            vector[index] += 1.0;
        }

        double norm = 0.0;
        for (double value : vector) {
            norm += value * value;
        }
        norm = Math.sqrt(norm);

        float[] embedding = new float[dimension];
        if (norm == 0.0) {
            return embedding;
        }
        for (int i = 0; i < dimension; i++) {
            embedding[i] = (float) (vector[i] / norm);
        }
        return embedding;
    }
}
