package io.reminor.cli;

import io.reminor.core.journal.JournalStats;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "stats", description = "Show writing statistics")
public final class StatsCommand implements Callable<Integer> {
    private final CliContext context;

    public StatsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            JournalStats stats = context.openRuntime().stats();
            System.out.println("Entries: " + stats.totalEntries());
            System.out.println("Words: " + stats.totalWords() + " (average " + stats.averageWords() + ")");
            System.out.println("Current streak: " + stats.currentStreak());
            System.out.println("Longest streak: " + stats.longestStreak());
            System.out.println("First entry: " + (stats.firstEntry() == null ? "-" : stats.firstEntry()));
            System.out.println("Last entry: " + (stats.lastEntry() == null ? "-" : stats.lastEntry()));
            System.out.println("Words last 7 days: " + stats.lastWeekWords() + " (previous 7 days: " + stats.previousWeekWords() + ")");
            return 0;
        } catch (Exception e) {
            System.err.println("Stats failed: " + e.getMessage());
            return 1;
        }
    }
}
