package io.reminor.core.search.vector;

import io.reminor.core.embedding.EmbeddingProvider;
import io.reminor.core.text.ContentHash;
import java.io.IOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-date embedding vectors with brute-force cosine ranking.
 *
 * <p>The vector map is copy-on-write: every mutation builds a new map, persists it and then
 * publishes it, so a query always ranks against one complete generation. Without an embedding
 * provider the index stays empty and every query returns no matches.
 */
public final class VectorIndex {
    private static final Logger LOG = LoggerFactory.getLogger(VectorIndex.class);

    private final Optional<EmbeddingProvider> provider;
    private final FileVectorStore store;
    private final double similarityFloor;
    private volatile Map<LocalDate, EmbeddingRecord> records;

    public VectorIndex(Optional<EmbeddingProvider> provider, FileVectorStore store, double similarityFloor) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.similarityFloor = similarityFloor;
        Map<LocalDate, EmbeddingRecord> loaded = new HashMap<>();
        if (provider.isPresent()) {
            for (EmbeddingRecord record : store.load(provider.get().name())) {
                loaded.put(record.date(), record);
            }
        }
        this.records = Collections.unmodifiableMap(loaded);
    }

    public boolean enabled() {
        return provider.isPresent();
    }

    public int size() {
        return records.size();
    }

    public boolean contains(LocalDate date) {
        return records.containsKey(date);
    }

    /**
     * Embeds {@code text} for {@code date} and persists the result before returning. A stored
     * vector computed from the same text is kept as is. If persisting fails, the date loses its
     * vector until the next reconcile.
     */
    public synchronized void upsert(LocalDate date, String text) throws IOException {
        if (provider.isEmpty()) {
            return;
        }
        String hash = ContentHash.sha256(text);
        EmbeddingRecord existing = records.get(date);
        if (existing != null && hash.equals(existing.contentHash())) {
            return;
        }

        Map<LocalDate, EmbeddingRecord> next = new HashMap<>(records);
        Optional<float[]> vector = embed(text);
        if (vector.isPresent()) {
            next.put(date, new EmbeddingRecord(date, hash, vector.get()));
        } else {
            next.remove(date);
        }
        try {
            publish(next);
        } catch (IOException e) {
            Map<LocalDate, EmbeddingRecord> withoutDate = new HashMap<>(records);
            withoutDate.remove(date);
            records = Collections.unmodifiableMap(withoutDate);
            throw e;
        }
    }

    /**
     * Embeds entries that have no vector or a stale one and drops vectors whose entry is gone.
     *
     * @return number of vectors added, replaced or removed
     */
    public synchronized int reconcile(Map<LocalDate, String> entries) throws IOException {
        if (provider.isEmpty()) {
            return 0;
        }
        Map<LocalDate, EmbeddingRecord> next = new HashMap<>(records);
        int changed = 0;
        if (next.keySet().retainAll(entries.keySet())) {
            changed += records.size() - next.size();
        }
        for (Map.Entry<LocalDate, String> entry : entries.entrySet()) {
            String hash = ContentHash.sha256(entry.getValue());
            EmbeddingRecord existing = next.get(entry.getKey());
            if (existing != null && hash.equals(existing.contentHash())) {
                continue;
            }
            Optional<float[]> vector = embed(entry.getValue());
            if (vector.isPresent()) {
                next.put(entry.getKey(), new EmbeddingRecord(entry.getKey(), hash, vector.get()));
                changed++;
            } else if (next.remove(entry.getKey()) != null) {
                changed++;
            }
        }
        if (changed > 0) {
            publish(next);
            LOG.info("Reconciled vector index: {} vectors changed, {} total", changed, next.size());
        }
        return changed;
    }

    /** Re-embeds every entry into a fresh map and swaps it in. */
    public synchronized void rebuild(Map<LocalDate, String> entries) throws IOException {
        if (provider.isEmpty()) {
            return;
        }
        Map<LocalDate, EmbeddingRecord> next = new HashMap<>();
        for (Map.Entry<LocalDate, String> entry : entries.entrySet()) {
            embed(entry.getValue()).ifPresent(vector -> next.put(
                entry.getKey(),
                new EmbeddingRecord(entry.getKey(), ContentHash.sha256(entry.getValue()), vector)
            ));
        }
        publish(next);
        LOG.info("Rebuilt vector index with {} vectors", next.size());
    }

    /**
     * Dates whose vectors have cosine similarity with {@code text} above the floor, best first.
     */
    public List<VectorMatch> query(String text, int k) {
        Map<LocalDate, EmbeddingRecord> current = records;
        if (provider.isEmpty() || current.isEmpty() || k <= 0 || text == null || text.isBlank()) {
            return List.of();
        }
        Optional<float[]> queryVector = embed(text);
        if (queryVector.isEmpty()) {
            return List.of();
        }

        List<VectorMatch> matches = new ArrayList<>();
        for (EmbeddingRecord record : current.values()) {
            double similarity = cosine(queryVector.get(), record.vector());
            if (similarity > similarityFloor) {
                matches.add(new VectorMatch(record.date(), similarity));
            }
        }
        matches.sort((left, right) -> {
            int bySimilarity = Double.compare(right.similarity(), left.similarity());
            return bySimilarity != 0 ? bySimilarity : left.date().compareTo(right.date());
        });
        return matches.size() > k ? List.copyOf(matches.subList(0, k)) : matches;
    }

    static double cosine(float[] a, float[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private Optional<float[]> embed(String text) {
        EmbeddingProvider embedder = provider.orElseThrow();
        try {
            float[] vector = embedder.embed(text);
            if (vector == null || vector.length == 0) {
                return Optional.empty();
            }
            return Optional.of(vector);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Embedding provider {} failed: {}", embedder.name(), e.getMessage());
            return Optional.empty();
        }
    }

    private void publish(Map<LocalDate, EmbeddingRecord> next) throws IOException {
        store.save(provider.orElseThrow().name(), next.values());
        records = Collections.unmodifiableMap(next);
    }
}
