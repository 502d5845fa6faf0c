package io.reminor.core.journal;

import java.io.IOException;
import java.time.LocalDate;
import java.util.Optional;
import java.util.SortedMap;

/**
 * Source of truth for journal text: one entry per calendar day.
 */
public interface EntryStore {
    /** Creates or overwrites the entry for {@code date}. */
    Entry save(LocalDate date, String text) throws IOException;

    Optional<Entry> find(LocalDate date);

    /** All entries, oldest first. */
    SortedMap<LocalDate, String> entries();

    /** Entries between {@code from} and {@code to}, both inclusive; either bound may be null. */
    SortedMap<LocalDate, String> entries(LocalDate from, LocalDate to);

    int count();

    /** Re-reads the backing storage, picking up edits made outside this process. */
    void reload() throws IOException;
}
