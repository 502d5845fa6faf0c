package io.reminor.core.search.vector;

import java.time.LocalDate;

public record VectorMatch(LocalDate date, double similarity) {
}
