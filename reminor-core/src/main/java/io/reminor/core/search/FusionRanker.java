package io.reminor.core.search;

import io.reminor.core.config.model.RetrievalConfig;
import io.reminor.core.journal.EntryStore;
import io.reminor.core.search.entity.EntityIndex;
import io.reminor.core.search.lexical.LexicalHit;
import io.reminor.core.search.lexical.LexicalSearchProvider;
import io.reminor.core.search.vector.VectorIndex;
import io.reminor.core.search.vector.VectorMatch;
import io.reminor.core.text.TextTokens;
import java.io.IOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combines entity, semantic, lexical and direct-text strategies into one ranking.
 *
 * <p>Entity hits win outright: when the query names a known person, place or thing, only
 * the entries mentioning it are returned.
 */
public final class FusionRanker {
    private static final Logger LOG = LoggerFactory.getLogger(FusionRanker.class);
    static final int PREVIEW_LENGTH = 500;

    private final Supplier<EntityIndex> entityIndex;
    private final VectorIndex vectorIndex;
    private final Optional<LexicalSearchProvider> lexical;
    private final DirectTextMatcher directMatcher;
    private final EntryStore entries;
    private final RetrievalConfig config;

    public FusionRanker(
        Supplier<EntityIndex> entityIndex,
        VectorIndex vectorIndex,
        Optional<LexicalSearchProvider> lexical,
        DirectTextMatcher directMatcher,
        EntryStore entries,
        RetrievalConfig config
    ) {
        this.entityIndex = Objects.requireNonNull(entityIndex, "entityIndex must not be null");
        this.vectorIndex = Objects.requireNonNull(vectorIndex, "vectorIndex must not be null");
        this.lexical = Objects.requireNonNull(lexical, "lexical must not be null");
        this.directMatcher = Objects.requireNonNull(directMatcher, "directMatcher must not be null");
        this.entries = Objects.requireNonNull(entries, "entries must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public List<SearchHit> search(String query, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
        if (limit == 0 || query == null || query.isBlank()) {
            return List.of();
        }

        List<SearchHit> entityHits = entityHits(query);
        if (!entityHits.isEmpty()) {
            return truncate(entityHits, limit);
        }

        int candidates = (int) Math.min(Integer.MAX_VALUE, (long) Math.max(1, config.candidateMultiplier()) * limit);
        Map<LocalDate, SearchHit> merged = new LinkedHashMap<>();
        semanticHits(query, candidates).forEach(hit -> merge(merged, hit));
        lexicalHits(query, limit).forEach(hit -> merge(merged, hit));
        directHits(query, candidates).forEach(hit -> merge(merged, hit));

        List<SearchHit> ranked = new ArrayList<>(merged.values());
        // List.sort is stable, so equal scores keep strategy order.
        ranked.sort(Comparator.comparingDouble(SearchHit::score).reversed());
        return truncate(ranked, limit);
    }

    private static void merge(Map<LocalDate, SearchHit> merged, SearchHit hit) {
        SearchHit existing = merged.get(hit.date());
        if (existing == null || hit.score() > existing.score()) {
            merged.put(hit.date(), hit);
        }
    }

    private List<SearchHit> entityHits(String query) {
        Map<LocalDate, Integer> scores;
        try {
            scores = entityIndex.get().lookup(TextTokens.bareTokens(query));
        } catch (RuntimeException e) {
            LOG.warn("Entity lookup failed: {}", e.getMessage());
            return List.of();
        }
        List<SearchHit> hits = new ArrayList<>();
        for (Map.Entry<LocalDate, Integer> score : scores.entrySet()) {
            entries.find(score.getKey()).ifPresent(entry -> hits.add(new SearchHit(
                entry.date(),
                Snippets.prefix(entry.text(), PREVIEW_LENGTH),
                score.getValue(),
                SearchSource.ENTITY
            )));
        }
        hits.sort(Comparator.comparingDouble(SearchHit::score).reversed()
            .thenComparing(SearchHit::date, Comparator.reverseOrder()));
        return hits;
    }

    private List<SearchHit> semanticHits(String query, int candidates) {
        List<SearchHit> hits = new ArrayList<>();
        try {
            for (VectorMatch match : vectorIndex.query(query, candidates)) {
                entries.find(match.date()).ifPresent(entry -> hits.add(new SearchHit(
                    entry.date(),
                    Snippets.prefix(entry.text(), PREVIEW_LENGTH),
                    match.similarity() * config.semanticScale(),
                    SearchSource.SEMANTIC
                )));
            }
        } catch (RuntimeException e) {
            LOG.warn("Semantic search failed: {}", e.getMessage());
        }
        return hits;
    }

    private List<SearchHit> lexicalHits(String query, int limit) {
        if (lexical.isEmpty()) {
            return List.of();
        }
        List<SearchHit> hits = new ArrayList<>();
        try {
            for (LexicalHit hit : lexical.get().find(query, limit)) {
                Optional<LocalDate> date = hit.date();
                if (date.isEmpty()) {
                    LOG.debug("Skipping lexical hit without a date: {}", hit.title());
                    continue;
                }
                hits.add(new SearchHit(date.get(), hit.snippet(), hit.score(), SearchSource.LEXICAL));
            }
        } catch (IOException | RuntimeException e) {
            LOG.warn("Lexical search failed: {}", e.getMessage());
        }
        return hits;
    }

    private List<SearchHit> directHits(String query, int candidates) {
        try {
            return directMatcher.search(query, candidates);
        } catch (RuntimeException e) {
            LOG.warn("Direct text search failed: {}", e.getMessage());
            return List.of();
        }
    }

    private static List<SearchHit> truncate(List<SearchHit> hits, int limit) {
        return hits.size() > limit ? List.copyOf(hits.subList(0, limit)) : List.copyOf(hits);
    }
}
