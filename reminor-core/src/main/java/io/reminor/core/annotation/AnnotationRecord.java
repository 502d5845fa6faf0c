package io.reminor.core.annotation;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-day analysis output: emotion scores in {@code [0, 1]} plus free-form insights.
 * {@code revision} starts at 1 and grows with every overwrite.
 */
public record AnnotationRecord(
    LocalDate date,
    Map<String, Double> emotions,
    Map<String, Object> insights,
    long revision,
    Instant updatedAt
) {

    public AnnotationRecord {
        Objects.requireNonNull(date, "date must not be null");
        emotions = copy(emotions);
        insights = copy(insights);
    }

    private static <V> Map<String, V> copy(Map<String, V> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
