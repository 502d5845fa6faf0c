package io.reminor.core.journal;

import java.time.LocalDate;
import java.util.Map;
import java.util.SortedMap;

/**
 * Writing statistics over a set of entries. Streaks count consecutive calendar days; the
 * current streak ends today and is zero when there is no entry for today.
 */
public record JournalStats(
    int totalEntries,
    long totalWords,
    long averageWords,
    int currentStreak,
    int longestStreak,
    LocalDate firstEntry,
    LocalDate lastEntry,
    long lastWeekWords,
    long previousWeekWords
) {

    public static JournalStats compute(SortedMap<LocalDate, String> entries, LocalDate today) {
        if (entries.isEmpty()) {
            return new JournalStats(0, 0, 0, 0, 0, null, null, 0, 0);
        }
        long totalWords = 0;
        long lastWeek = 0;
        long previousWeek = 0;
        int longest = 0;
        int run = 0;
        LocalDate previous = null;
        for (Map.Entry<LocalDate, String> entry : entries.entrySet()) {
            LocalDate date = entry.getKey();
            long words = wordCount(entry.getValue());
            totalWords += words;

            long age = today.toEpochDay() - date.toEpochDay();
            if (age >= 0 && age < 7) {
                lastWeek += words;
            } else if (age >= 7 && age < 14) {
                previousWeek += words;
            }

            run = previous != null && previous.plusDays(1).equals(date) ? run + 1 : 1;
            longest = Math.max(longest, run);
            previous = date;
        }

        int current = 0;
        for (LocalDate day = today; entries.containsKey(day); day = day.minusDays(1)) {
            current++;
        }

        return new JournalStats(
            entries.size(),
            totalWords,
            totalWords / entries.size(),
            current,
            longest,
            entries.firstKey(),
            entries.lastKey(),
            lastWeek,
            previousWeek
        );
    }

    public static long wordCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }
}
