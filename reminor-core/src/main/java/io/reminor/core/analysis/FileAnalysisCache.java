package io.reminor.core.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.reminor.core.text.ContentHash;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One JSON file per content hash. Lookups for different texts never contend.
 */
public final class FileAnalysisCache implements AnalysisCache {
    private static final Logger LOG = LoggerFactory.getLogger(FileAnalysisCache.class);
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final String schemaVersion;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    public FileAnalysisCache(Path directory, String schemaVersion) {
        this(directory, schemaVersion, Clock.systemUTC());
    }

    public FileAnalysisCache(Path directory, String schemaVersion, Clock clock) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        if (schemaVersion == null || schemaVersion.isBlank()) {
            throw new IllegalArgumentException("schemaVersion must not be blank");
        }
        this.schemaVersion = schemaVersion;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public String schemaVersion() {
        return schemaVersion;
    }

    @Override
    public AnalysisResult getOrCompute(String text, AnalysisFunction fn) throws IOException {
        Objects.requireNonNull(fn, "fn must not be null");
        String hash = ContentHash.sha256(text == null ? "" : text);
        synchronized (locks.computeIfAbsent(hash, ignored -> new Object())) {
            Optional<CacheEntry> cached = read(hash);
            if (cached.isPresent() && schemaVersion.equals(cached.get().schemaVersion()) && cached.get().result() != null) {
                LOG.debug("Analysis cache hit {}", hash);
                return cached.get().result();
            }
            LOG.debug("Analysis cache miss {}", hash);
            AnalysisResult result = fn.apply(text);
            if (result == null) {
                throw new IOException("analysis function returned no result");
            }
            write(new CacheEntry(hash, schemaVersion, result, clock.instant()));
            return result;
        }
    }

    @Override
    public int purgeStale() throws IOException {
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        int removed = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                String hash = name.substring(0, name.length() - SUFFIX.length());
                synchronized (locks.computeIfAbsent(hash, ignored -> new Object())) {
                    Optional<CacheEntry> entry = read(hash);
                    if (entry.isEmpty() || !schemaVersion.equals(entry.get().schemaVersion())) {
                        Files.deleteIfExists(file);
                        removed++;
                    }
                }
            }
        }
        if (removed > 0) {
            LOG.info("Purged {} stale analysis cache entries", removed);
        }
        return removed;
    }

    Path pathFor(String hash) {
        return directory.resolve(hash + SUFFIX);
    }

    private Optional<CacheEntry> read(String hash) {
        Path path = pathFor(hash);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mapper.readValue(Files.readString(path), CacheEntry.class));
        } catch (IOException e) {
            LOG.warn("Ignoring corrupt analysis cache entry {}: {}", path.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    private void write(CacheEntry entry) throws IOException {
        Files.createDirectories(directory);
        Path path = pathFor(entry.contentHash());
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(entry) + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
