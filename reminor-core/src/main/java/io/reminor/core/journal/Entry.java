package io.reminor.core.journal;

import java.time.LocalDate;
import java.util.Objects;

public record Entry(LocalDate date, String text) {

    public Entry {
        Objects.requireNonNull(date, "date must not be null");
        text = text == null ? "" : text;
    }
}
