package io.reminor.core.annotation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One {@code <date>.json} envelope per annotated day. Writes lock only their own date.
 */
public final class FileAnnotationStore implements AnnotationStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileAnnotationStore.class);
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final Clock clock;
    private final AnnotationCodec codec = new AnnotationCodec();
    private final Map<LocalDate, Object> locks = new ConcurrentHashMap<>();

    public FileAnnotationStore(Path directory) {
        this(directory, Clock.systemUTC());
    }

    public FileAnnotationStore(Path directory, Clock clock) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public AnnotationRecord save(LocalDate date, Map<String, Double> emotions, Map<String, Object> insights) throws IOException {
        Objects.requireNonNull(date, "date must not be null");
        synchronized (lockFor(date)) {
            long revision = readEnvelope(date).map(envelope -> envelope.path("revision").asLong(0)).orElse(0L) + 1;
            Instant now = clock.instant();
            ObjectNode envelope = codec.mapper().createObjectNode();
            envelope.put("format", AnnotationCodec.FORMAT);
            envelope.put("date", date.toString());
            envelope.put("revision", revision);
            envelope.put("updatedAt", now.toString());
            envelope.put("emotions", codec.encodeEmotions(emotions));
            envelope.put("insights", codec.encodeInsights(insights));

            Files.createDirectories(directory);
            Path path = pathFor(date);
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            Files.writeString(tmp, codec.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(envelope) + System.lineSeparator());
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            return load(date).orElseThrow(() -> new IOException("Annotation for " + date + " unreadable after save"));
        }
    }

    @Override
    public Optional<AnnotationRecord> load(LocalDate date) {
        if (date == null) {
            return Optional.empty();
        }
        synchronized (lockFor(date)) {
            return readEnvelope(date).flatMap(envelope -> codec.toRecord(
                date,
                envelope.path("revision").asLong(1),
                updatedAt(envelope),
                AnnotationCodec.rawField(envelope, "emotions"),
                AnnotationCodec.rawField(envelope, "insights")
            ));
        }
    }

    @Override
    public List<LocalDate> dates() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<LocalDate> dates = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                try {
                    dates.add(LocalDate.parse(name.substring(0, name.length() - SUFFIX.length())));
                } catch (DateTimeParseException e) {
                    LOG.debug("Ignoring non-annotation file {}", name);
                }
            }
        } catch (IOException e) {
            LOG.warn("Failed to list annotations in {}: {}", directory, e.getMessage());
            return List.of();
        }
        Collections.sort(dates);
        return dates;
    }

    Path pathFor(LocalDate date) {
        return directory.resolve(date + SUFFIX);
    }

    private Optional<JsonNode> readEnvelope(LocalDate date) {
        Path path = pathFor(date);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            JsonNode envelope = codec.mapper().readTree(Files.readString(path));
            if (envelope == null || !envelope.isObject()) {
                LOG.warn("Annotation file {} is not a JSON object", path);
                return Optional.empty();
            }
            return Optional.of(envelope);
        } catch (IOException e) {
            LOG.warn("Failed to read annotation {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    private static Instant updatedAt(JsonNode envelope) {
        String raw = envelope.path("updatedAt").asText("");
        try {
            return raw.isBlank() ? null : Instant.parse(raw);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private Object lockFor(LocalDate date) {
        return locks.computeIfAbsent(date, ignored -> new Object());
    }
}
