package io.reminor.cli;

import io.reminor.core.engine.ImportReport;
import io.reminor.core.engine.ImportStatus;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "import", description = "Import text files; the date is read from each file name")
public final class ImportCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(arity = "1..*", description = "Files to import")
    List<Path> files;

    public ImportCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ImportReport report = context.openRuntime().importer().importFiles(files);
            for (ImportReport.FileResult file : report.files()) {
                String detail = file.status() == ImportStatus.SUCCESS ? file.wordCount() + " words" : file.message();
                System.out.println(file.status() + "  " + file.fileName() + "  " + (file.date() == null ? "-" : file.date()) + "  " + detail);
            }
            System.out.println("Imported " + report.imported() + ", skipped " + report.skipped() + ", errors " + report.errors());
            return report.errors() == 0 ? 0 : 1;
        } catch (Exception e) {
            System.err.println("Import failed: " + e.getMessage());
            return 1;
        }
    }
}
