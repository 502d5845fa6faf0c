package io.reminor.core.journal;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.util.TreeMap;
import org.junit.jupiter.api.Test;

class JournalStatsTest {

    @Test
    void shouldComputeCurrentAndLongestStreaks() {
        TreeMap<LocalDate, String> entries = new TreeMap<>();
        for (int day : new int[] {1, 2, 3, 4, 10, 11, 15, 16}) {
            entries.put(LocalDate.of(2024, 6, day), "one two three");
        }

        JournalStats stats = JournalStats.compute(entries, LocalDate.of(2024, 6, 16));

        assertThat(stats.totalEntries()).isEqualTo(8);
        assertThat(stats.totalWords()).isEqualTo(24);
        assertThat(stats.averageWords()).isEqualTo(3);
        assertThat(stats.currentStreak()).isEqualTo(2);
        assertThat(stats.longestStreak()).isEqualTo(4);
        assertThat(stats.firstEntry()).isEqualTo(LocalDate.of(2024, 6, 1));
        assertThat(stats.lastEntry()).isEqualTo(LocalDate.of(2024, 6, 16));
        assertThat(stats.lastWeekWords()).isEqualTo(12);
        assertThat(stats.previousWeekWords()).isEqualTo(6);
    }

    @Test
    void currentStreakShouldBeZeroWithoutAnEntryToday() {
        TreeMap<LocalDate, String> entries = new TreeMap<>();
        entries.put(LocalDate.of(2024, 6, 14), "yesterday's words");

        JournalStats stats = JournalStats.compute(entries, LocalDate.of(2024, 6, 16));

        assertThat(stats.currentStreak()).isZero();
        assertThat(stats.longestStreak()).isEqualTo(1);
    }

    @Test
    void shouldHandleAnEmptyJournal() {
        JournalStats stats = JournalStats.compute(new TreeMap<>(), LocalDate.of(2024, 6, 16));

        assertThat(stats.totalEntries()).isZero();
        assertThat(stats.firstEntry()).isNull();
    }
}
