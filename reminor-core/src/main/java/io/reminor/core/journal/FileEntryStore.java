package io.reminor.core.journal;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores each entry as {@code <yyyy-MM-dd>.txt} inside a journal directory and keeps an
 * in-memory copy for searching.
 */
public final class FileEntryStore implements EntryStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileEntryStore.class);
    private static final Pattern FILE_NAME = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2})\\.txt$");

    private final Path directory;
    private final ConcurrentSkipListMap<LocalDate, String> cache = new ConcurrentSkipListMap<>();

    public FileEntryStore(Path directory) throws IOException {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        Files.createDirectories(directory);
        reload();
    }

    @Override
    public synchronized Entry save(LocalDate date, String text) throws IOException {
        Objects.requireNonNull(date, "date must not be null");
        String normalized = text == null ? "" : text.strip();
        if (normalized.isBlank()) {
            throw new IllegalArgumentException("entry text must not be blank");
        }

        Path path = pathFor(date);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, normalized, StandardCharsets.UTF_8);
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        cache.put(date, normalized);
        return new Entry(date, normalized);
    }

    @Override
    public Optional<Entry> find(LocalDate date) {
        if (date == null) {
            return Optional.empty();
        }
        String text = cache.get(date);
        return text == null ? Optional.empty() : Optional.of(new Entry(date, text));
    }

    @Override
    public SortedMap<LocalDate, String> entries() {
        return Collections.unmodifiableSortedMap(new TreeMap<>(cache));
    }

    @Override
    public SortedMap<LocalDate, String> entries(LocalDate from, LocalDate to) {
        SortedMap<LocalDate, String> view;
        if (from != null && to != null) {
            if (to.isBefore(from)) {
                return Collections.emptySortedMap();
            }
            view = cache.subMap(from, true, to, true);
        } else if (from != null) {
            view = cache.tailMap(from, true);
        } else if (to != null) {
            view = cache.headMap(to, true);
        } else {
            view = cache;
        }
        return Collections.unmodifiableSortedMap(new TreeMap<>(view));
    }

    @Override
    public int count() {
        return cache.size();
    }

    @Override
    public synchronized void reload() throws IOException {
        TreeMap<LocalDate, String> loaded = new TreeMap<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*.txt")) {
            for (Path file : files) {
                Matcher matcher = FILE_NAME.matcher(file.getFileName().toString());
                if (!matcher.matches()) {
                    continue;
                }
                LocalDate date;
                try {
                    date = LocalDate.parse(matcher.group(1));
                } catch (DateTimeParseException e) {
                    LOG.warn("Skipping journal file with invalid date: {}", file.getFileName());
                    continue;
                }
                String content = Files.readString(file, StandardCharsets.UTF_8).strip();
                if (!content.isEmpty()) {
                    loaded.put(date, content);
                }
            }
        }
        cache.clear();
        cache.putAll(loaded);
        LOG.debug("Loaded {} journal entries from {}", loaded.size(), directory);
    }

    public Path directory() {
        return directory;
    }

    private Path pathFor(LocalDate date) {
        return directory.resolve(date + ".txt");
    }
}
