package io.reminor.core.search;

import java.time.LocalDate;
import java.util.Objects;

public record SearchHit(LocalDate date, String snippet, double score, SearchSource source) {

    public SearchHit {
        Objects.requireNonNull(date, "date must not be null");
        Objects.requireNonNull(source, "source must not be null");
        snippet = snippet == null ? "" : snippet;
    }
}
