package io.reminor.core.engine;

import io.reminor.core.journal.EntryStore;
import io.reminor.core.journal.JournalStats;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bulk-loads entries written elsewhere, then rebuilds the engine's indexes once.
 */
public final class JournalImporter {
    private static final Logger LOG = LoggerFactory.getLogger(JournalImporter.class);
    static final int MIN_CONTENT_LENGTH = 10;
    private static final Pattern YEAR_FIRST = Pattern.compile("(\\d{4})[-_](\\d{2})[-_](\\d{2})");
    private static final Pattern DAY_FIRST = Pattern.compile("(\\d{2})[-_](\\d{2})[-_](\\d{4})");

    private final EntryStore entries;
    private final JournalEngine engine;
    private final Clock clock;
    private final ZoneId zoneId;

    public JournalImporter(EntryStore entries, JournalEngine engine, Clock clock, ZoneId zoneId) {
        this.entries = Objects.requireNonNull(entries, "entries must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zoneId = Objects.requireNonNull(zoneId, "zoneId must not be null");
    }

    /**
     * Reads each file as UTF-8 (Latin-1 when it is not valid UTF-8) and imports it. The date
     * comes from the file name, or today when the name carries none.
     */
    public ImportReport importFiles(List<Path> files) throws IOException {
        List<ImportItem> items = new ArrayList<>();
        List<ImportReport.FileResult> unreadable = new ArrayList<>();
        for (Path file : files) {
            String name = file.getFileName().toString();
            try {
                items.add(new ImportItem(name, null, read(file)));
            } catch (IOException e) {
                LOG.warn("Cannot read {}: {}", file, e.getMessage());
                unreadable.add(new ImportReport.FileResult(name, null, 0, ImportStatus.ERROR, e.getMessage()));
            }
        }
        ImportReport report = importEntries(items);
        if (unreadable.isEmpty()) {
            return report;
        }
        List<ImportReport.FileResult> all = new ArrayList<>(report.files());
        all.addAll(unreadable);
        return new ImportReport(report.imported(), report.skipped(), report.errors() + unreadable.size(), all);
    }

    public ImportReport importEntries(List<ImportItem> items) throws IOException {
        List<ImportReport.FileResult> results = new ArrayList<>();
        int imported = 0;
        int skipped = 0;
        int errors = 0;
        for (ImportItem item : items) {
            String name = item.fileName() == null ? "" : item.fileName();
            LocalDate date = item.date() != null ? item.date() : dateFromFileName(name).orElse(LocalDate.now(clock.withZone(zoneId)));
            String content = item.content() == null ? "" : item.content();
            if (content.strip().length() < MIN_CONTENT_LENGTH) {
                results.add(new ImportReport.FileResult(name, date, 0, ImportStatus.SKIPPED,
                    "content too short (min " + MIN_CONTENT_LENGTH + " chars)"));
                skipped++;
                continue;
            }
            try {
                entries.save(date, content);
                results.add(new ImportReport.FileResult(name, date, JournalStats.wordCount(content), ImportStatus.SUCCESS, null));
                imported++;
            } catch (IOException | RuntimeException e) {
                LOG.warn("Failed to import {} as {}: {}", name, date, e.getMessage());
                results.add(new ImportReport.FileResult(name, date, 0, ImportStatus.ERROR, e.getMessage()));
                errors++;
            }
        }
        if (imported > 0) {
            engine.rebuildIndexes();
        }
        LOG.info("Import finished: {} imported, {} skipped, {} errors", imported, skipped, errors);
        return new ImportReport(imported, skipped, errors, results);
    }

    /**
     * Recognizes {@code 2024-01-15}, {@code 2024_01_15} and {@code 15-01-2024} anywhere in the
     * name, e.g. {@code diario_2024-01-15.txt}.
     */
    public static Optional<LocalDate> dateFromFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        Matcher matcher = YEAR_FIRST.matcher(fileName);
        if (matcher.find()) {
            return date(matcher.group(1), matcher.group(2), matcher.group(3));
        }
        matcher = DAY_FIRST.matcher(fileName);
        if (matcher.find()) {
            return date(matcher.group(3), matcher.group(2), matcher.group(1));
        }
        return Optional.empty();
    }

    private static Optional<LocalDate> date(String year, String month, String day) {
        try {
            return Optional.of(LocalDate.of(Integer.parseInt(year), Integer.parseInt(month), Integer.parseInt(day)));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private static String read(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        try {
            return StandardCharsets.UTF_8.newDecoder().decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            return new String(bytes, StandardCharsets.ISO_8859_1);
        }
    }
}
