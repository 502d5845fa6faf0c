package io.reminor.core.journal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileEntryStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldSaveAndOverwriteEntries() throws Exception {
        FileEntryStore store = new FileEntryStore(tempDir);
        LocalDate date = LocalDate.of(2024, 6, 15);

        store.save(date, "  Lunch with Maria.  ");
        store.save(date, "Lunch with Maria at the lake.");

        assertThat(store.count()).isEqualTo(1);
        assertThat(store.find(date)).map(Entry::text).contains("Lunch with Maria at the lake.");
        assertThat(Files.readString(tempDir.resolve("2024-06-15.txt"))).isEqualTo("Lunch with Maria at the lake.");
    }

    @Test
    void shouldRejectBlankText() throws Exception {
        FileEntryStore store = new FileEntryStore(tempDir);

        assertThatThrownBy(() -> store.save(LocalDate.of(2024, 6, 15), "   "))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.count()).isZero();
    }

    @Test
    void reloadShouldPickUpFilesWrittenElsewhere() throws Exception {
        FileEntryStore store = new FileEntryStore(tempDir);
        Files.writeString(tempDir.resolve("2024-06-20.txt"), "Dinner with Giulia");
        Files.writeString(tempDir.resolve("notes.txt"), "not an entry");
        Files.writeString(tempDir.resolve("2024-02-30.txt"), "invalid date");

        assertThat(store.find(LocalDate.of(2024, 6, 20))).isEmpty();
        store.reload();

        assertThat(store.count()).isEqualTo(1);
        assertThat(store.find(LocalDate.of(2024, 6, 20))).isPresent();
    }

    @Test
    void shouldReturnInclusiveDateRanges() throws Exception {
        FileEntryStore store = new FileEntryStore(tempDir);
        store.save(LocalDate.of(2024, 6, 1), "first");
        store.save(LocalDate.of(2024, 6, 10), "second");
        store.save(LocalDate.of(2024, 6, 20), "third");

        assertThat(store.entries(LocalDate.of(2024, 6, 1), LocalDate.of(2024, 6, 10)).keySet())
            .containsExactly(LocalDate.of(2024, 6, 1), LocalDate.of(2024, 6, 10));
        assertThat(store.entries(LocalDate.of(2024, 6, 5), null).keySet())
            .containsExactly(LocalDate.of(2024, 6, 10), LocalDate.of(2024, 6, 20));
        assertThat(store.entries(LocalDate.of(2024, 6, 20), LocalDate.of(2024, 6, 1))).isEmpty();
    }
}
