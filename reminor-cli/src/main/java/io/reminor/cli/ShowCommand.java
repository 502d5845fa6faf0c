package io.reminor.cli;

import io.reminor.core.engine.ReminorRuntime;
import io.reminor.core.journal.Entry;
import java.time.LocalDate;
import java.util.Optional;
import java.util.SortedMap;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "show", description = "Print the entry for a day, or every entry in a range")
public final class ShowCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "0..1", description = "Day to show (default: today)")
    String date;

    @Option(names = "--from", description = "First day of the range")
    String from;

    @Option(names = "--to", description = "Last day of the range")
    String to;

    public ShowCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ReminorRuntime runtime = context.openRuntime();
            if (from != null || to != null) {
                LocalDate start = from == null ? null : CliDates.parse(from, runtime);
                LocalDate end = to == null ? null : CliDates.parse(to, runtime);
                SortedMap<LocalDate, String> entries = runtime.engine().entries(start, end);
                if (entries.isEmpty()) {
                    System.out.println("No entries in range");
                }
                entries.forEach((day, text) -> System.out.println("=== " + day + " ===\n" + text + "\n"));
                return 0;
            }
            LocalDate day = CliDates.parse(date, runtime);
            Optional<Entry> entry = runtime.engine().entry(day);
            if (entry.isEmpty()) {
                System.out.println("No entry for " + day);
                return 1;
            }
            System.out.println("=== " + day + " ===");
            System.out.println(entry.get().text());
            return 0;
        } catch (Exception e) {
            System.err.println("Show failed: " + e.getMessage());
            return 1;
        }
    }
}
