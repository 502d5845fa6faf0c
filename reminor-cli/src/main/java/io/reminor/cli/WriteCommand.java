package io.reminor.cli;

import io.reminor.core.engine.ReminorRuntime;
import io.reminor.core.journal.Entry;
import io.reminor.core.journal.JournalStats;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "write", description = "Write or overwrite the entry for a day")
public final class WriteCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(arity = "1..*", description = "Entry text")
    List<String> text;

    @Option(names = {"-d", "--date"}, description = "Day of the entry (default: today)")
    String date;

    @Option(names = {"-a", "--append"}, description = "Append to the existing entry instead of replacing it")
    boolean append;

    public WriteCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ReminorRuntime runtime = context.openRuntime();
            String body = String.join(" ", text);
            LocalDate day = CliDates.parse(date, runtime);
            if (append) {
                body = runtime.engine().entry(day).map(existing -> existing.text() + "\n\n").orElse("") + body;
            }
            Entry saved = runtime.engine().saveEntry(day, body);
            System.out.println("Saved " + saved.date() + " (" + JournalStats.wordCount(saved.text()) + " words)");
            return 0;
        } catch (Exception e) {
            System.err.println("Write failed: " + e.getMessage());
            return 1;
        }
    }
}
