package io.reminor.cli;

import io.reminor.core.annotation.AnnotationRecord;
import io.reminor.core.engine.ReminorRuntime;
import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "analyze", description = "Score the emotions of a day's entry and store them as its annotation")
public final class AnalyzeCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "0..1", description = "Day to analyze (default: today)")
    String date;

    public AnalyzeCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ReminorRuntime runtime = context.openRuntime();
            LocalDate day = CliDates.parse(date, runtime);
            Optional<AnnotationRecord> record = runtime.analysis().analyze(day);
            if (record.isEmpty()) {
                System.out.println("No entry for " + day);
                return 1;
            }
            AnnotationPrinter.print(record.get(), runtime.analysis().dominantEmotion(record.get().emotions()));
            return 0;
        } catch (Exception e) {
            System.err.println("Analyze failed: " + e.getMessage());
            return 1;
        }
    }
}
