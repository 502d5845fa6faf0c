package io.reminor.core.engine;

import java.time.LocalDate;
import java.util.List;

public record ImportReport(int imported, int skipped, int errors, List<FileResult> files) {

    public ImportReport {
        files = files == null ? List.of() : List.copyOf(files);
    }

    public int total() {
        return files.size();
    }

    public record FileResult(String fileName, LocalDate date, long wordCount, ImportStatus status, String message) {
    }
}
