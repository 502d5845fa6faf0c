package io.reminor.cli;

import io.reminor.core.annotation.AnnotationRecord;
import java.util.Locale;
import java.util.Optional;

final class AnnotationPrinter {

    private AnnotationPrinter() {
    }

    static void print(AnnotationRecord record, Optional<String> dominant) {
        System.out.println("=== " + record.date() + " (revision " + record.revision() + ") ===");
        record.emotions().forEach((emotion, score) ->
            System.out.println(String.format(Locale.ROOT, "  %-12s %.2f", emotion, score)));
        System.out.println("Dominant: " + dominant.orElse("-"));
        record.insights().forEach((key, value) -> System.out.println("  " + key + ": " + value));
    }
}
