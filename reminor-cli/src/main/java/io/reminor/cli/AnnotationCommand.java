package io.reminor.cli;

import io.reminor.core.annotation.AnnotationRecord;
import io.reminor.core.engine.ReminorRuntime;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "annotation", description = "Show the stored annotation for a day, or a week of emotion scores")
public final class AnnotationCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "0..1", description = "Day (default: today)")
    String date;

    @Option(names = {"-w", "--week"}, description = "Show the seven days ending on the given day")
    boolean week;

    public AnnotationCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ReminorRuntime runtime = context.openRuntime();
            LocalDate day = CliDates.parse(date, runtime);
            if (week) {
                List<LocalDate> days = new ArrayList<>();
                for (int i = 6; i >= 0; i--) {
                    days.add(day.minusDays(i));
                }
                Map<LocalDate, Map<String, Double>> matrix = runtime.analysis().weeklyEmotions(days);
                matrix.forEach((d, emotions) -> System.out.println(String.format(
                    Locale.ROOT,
                    "%s  %s",
                    d,
                    emotions.isEmpty() ? "-" : runtime.analysis().dominantEmotion(emotions).orElse("neutral")
                )));
                return 0;
            }
            Optional<AnnotationRecord> record = runtime.engine().loadAnnotation(day);
            if (record.isEmpty()) {
                System.out.println("No annotation for " + day);
                return 1;
            }
            AnnotationPrinter.print(record.get(), runtime.analysis().dominantEmotion(record.get().emotions()));
            return 0;
        } catch (Exception e) {
            System.err.println("Annotation failed: " + e.getMessage());
            return 1;
        }
    }
}
