package io.reminor.core.engine;

import java.time.LocalDate;

/**
 * One entry to import. A null {@code date} is taken from the file name.
 */
public record ImportItem(String fileName, LocalDate date, String content) {
}
