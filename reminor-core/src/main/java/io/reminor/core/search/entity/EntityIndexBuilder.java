package io.reminor.core.search.entity;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

public final class EntityIndexBuilder {
    private final EntityExtractor extractor;

    public EntityIndexBuilder(EntityExtractor extractor) {
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
    }

    /** Scans every entry once and returns a fresh index. */
    public EntityIndex build(Map<LocalDate, String> entries) {
        Map<String, Map<LocalDate, Integer>> index = new HashMap<>();
        for (Map.Entry<LocalDate, String> entry : entries.entrySet()) {
            extractor.extract(entry.getValue()).forEach((entity, count) ->
                index.computeIfAbsent(entity, ignored -> new HashMap<>()).put(entry.getKey(), count)
            );
        }
        return EntityIndex.of(index);
    }

    public EntityIndex update(EntityIndex current, LocalDate date, String text) {
        return current.withEntry(date, extractor.extract(text));
    }
}
