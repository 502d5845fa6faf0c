package io.reminor.core.search.vector;

import java.time.LocalDate;

/**
 * Vector for one entry. {@code contentHash} identifies the text the vector was computed from.
 */
public record EmbeddingRecord(LocalDate date, String contentHash, float[] vector) {
}
