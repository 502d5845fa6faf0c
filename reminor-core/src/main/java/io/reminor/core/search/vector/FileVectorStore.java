package io.reminor.core.search.vector;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists embedding vectors as a single JSON document, replaced atomically on every write.
 * Vectors produced by a different provider are discarded on load.
 */
public final class FileVectorStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileVectorStore.class);

    private final Path path;
    private final ObjectMapper mapper;

    public FileVectorStore(Path path) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public synchronized List<EmbeddingRecord> load(String provider) {
        if (!Files.exists(path)) {
            return List.of();
        }
        try {
            StoredVectors stored = mapper.readValue(Files.readString(path), StoredVectors.class);
            if (stored.records() == null) {
                return List.of();
            }
            if (!Objects.equals(stored.provider(), provider)) {
                LOG.info("Discarding {} vectors from provider {} (current: {})", stored.records().size(), stored.provider(), provider);
                return List.of();
            }
            return stored.records();
        } catch (Exception e) {
            LOG.warn("Vector file {} is unreadable, starting empty: {}", path, e.getMessage());
            return List.of();
        }
    }

    public synchronized void save(String provider, Collection<EmbeddingRecord> records) throws IOException {
        Files.createDirectories(path.toAbsolutePath().getParent());
        String json = mapper.writeValueAsString(new StoredVectors(provider, new ArrayList<>(records)));
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    public Path path() {
        return path;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StoredVectors(String provider, List<EmbeddingRecord> records) {
    }
}
