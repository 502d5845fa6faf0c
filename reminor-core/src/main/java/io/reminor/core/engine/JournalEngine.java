package io.reminor.core.engine;

import io.reminor.core.annotation.AnnotationRecord;
import io.reminor.core.annotation.AnnotationStore;
import io.reminor.core.config.model.RetrievalConfig;
import io.reminor.core.context.ContextAssembler;
import io.reminor.core.journal.Entry;
import io.reminor.core.journal.EntryStore;
import io.reminor.core.search.DirectTextMatcher;
import io.reminor.core.search.FusionRanker;
import io.reminor.core.search.SearchHit;
import io.reminor.core.search.entity.EntityIndex;
import io.reminor.core.search.entity.EntityIndexBuilder;
import io.reminor.core.search.lexical.LexicalDocument;
import io.reminor.core.search.lexical.LexicalSearchProvider;
import io.reminor.core.search.vector.VectorIndex;
import io.reminor.core.temporal.TemporalQueryResolver;
import io.reminor.core.text.Language;
import java.io.IOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point used by the presentation layer: saves entries, keeps the derived indexes in
 * step with them and answers retrieval questions.
 *
 * <p>Queries run under the read lock; saves and rebuilds hold the write lock, so a query
 * always sees one complete generation of the indexes.
 */
public final class JournalEngine {
    private static final Logger LOG = LoggerFactory.getLogger(JournalEngine.class);

    private final EntryStore entries;
    private final VectorIndex vectors;
    private final Optional<LexicalSearchProvider> lexical;
    private final EntityIndexBuilder entityBuilder;
    private final AnnotationStore annotations;
    private final FusionRanker ranker;
    private final ContextAssembler assembler;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile EntityIndex entityIndex = EntityIndex.empty();

    public JournalEngine(
        EntryStore entries,
        VectorIndex vectors,
        Optional<LexicalSearchProvider> lexical,
        EntityIndexBuilder entityBuilder,
        AnnotationStore annotations,
        TemporalQueryResolver resolver,
        Language language,
        RetrievalConfig retrieval
    ) {
        this.entries = Objects.requireNonNull(entries, "entries must not be null");
        this.vectors = Objects.requireNonNull(vectors, "vectors must not be null");
        this.lexical = Objects.requireNonNull(lexical, "lexical must not be null");
        this.entityBuilder = Objects.requireNonNull(entityBuilder, "entityBuilder must not be null");
        this.annotations = Objects.requireNonNull(annotations, "annotations must not be null");
        this.ranker = new FusionRanker(
            () -> entityIndex,
            vectors,
            lexical,
            new DirectTextMatcher(entries, retrieval),
            entries,
            retrieval
        );
        this.assembler = new ContextAssembler(language, resolver, ranker, entries, retrieval);
    }

    /**
     * Brings derived indexes in line with the entry store: builds the entity and lexical
     * indexes and embeds entries whose vectors are missing or stale.
     */
    public void start() throws IOException {
        lock.writeLock().lock();
        try {
            SortedMap<LocalDate, String> all = entries.entries();
            entityIndex = entityBuilder.build(all);
            refillLexical(all);
            int changed = vectors.reconcile(all);
            LOG.info("Journal engine ready: {} entries, {} entities, {} vectors ({} reconciled)",
                all.size(), entityIndex.size(), vectors.size(), changed);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public String assembleContext(String query) {
        lock.readLock().lock();
        try {
            return assembler.assemble(query);
        } finally {
            lock.readLock().unlock();
        }
    }

    public String assembleContext(String query, int maxSnippets) {
        lock.readLock().lock();
        try {
            return assembler.assemble(query, maxSnippets);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<SearchHit> search(String query, int limit) {
        lock.readLock().lock();
        try {
            return ranker.search(query, limit);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Creates or overwrites the entry for {@code date} and updates every derived index before
     * returning. Saving the same text twice leaves all indexes unchanged. The vector step runs last,
     * so a failed vector write still leaves the entity and lexical indexes on the new text.
     */
    public Entry saveEntry(LocalDate date, String text) throws IOException {
        Objects.requireNonNull(date, "date must not be null");
        lock.writeLock().lock();
        try {
            Entry saved = entries.save(date, text);
            entityIndex = entityBuilder.update(entityIndex, saved.date(), saved.text());
            if (lexical.isPresent()) {
                try {
                    lexical.get().put(LexicalDocument.forEntry(saved.date(), saved.text()));
                } catch (IOException | RuntimeException e) {
                    LOG.warn("Lexical index update failed for {}: {}", saved.date(), e.getMessage());
                }
            }
            vectors.upsert(saved.date(), saved.text());
            return saved;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<Entry> entry(LocalDate date) {
        return entries.find(date);
    }

    public SortedMap<LocalDate, String> entries(LocalDate from, LocalDate to) {
        return entries.entries(from, to);
    }

    public AnnotationRecord saveAnnotation(LocalDate date, Map<String, Double> emotions, Map<String, Object> insights)
        throws IOException {
        return annotations.save(date, emotions, insights);
    }

    public Optional<AnnotationRecord> loadAnnotation(LocalDate date) {
        return annotations.load(date);
    }

    /**
     * Re-reads the entry store and rebuilds every derived index from scratch. Use after bulk
     * imports or edits made outside the engine.
     */
    public void rebuildIndexes() throws IOException {
        lock.writeLock().lock();
        try {
            entries.reload();
            SortedMap<LocalDate, String> all = entries.entries();
            EntityIndex rebuilt = entityBuilder.build(all);
            vectors.rebuild(all);
            refillLexical(all);
            entityIndex = rebuilt;
            LOG.info("Rebuilt indexes: {} entries, {} entities, {} vectors", all.size(), rebuilt.size(), vectors.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public EngineStatus status() {
        return new EngineStatus(entries.count(), entityIndex.size(), vectors.enabled(), vectors.size(), lexical.isPresent());
    }

    EntityIndex entityIndex() {
        return entityIndex;
    }

    private void refillLexical(Map<LocalDate, String> all) {
        if (lexical.isEmpty()) {
            return;
        }
        List<LexicalDocument> documents = new ArrayList<>();
        all.forEach((date, text) -> documents.add(LexicalDocument.forEntry(date, text)));
        try {
            lexical.get().clear();
            lexical.get().putMany(documents);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Lexical index rebuild failed: {}", e.getMessage());
        }
    }
}
