package io.reminor.core.context;

import io.reminor.core.config.model.RetrievalConfig;
import io.reminor.core.journal.Entry;
import io.reminor.core.journal.EntryStore;
import io.reminor.core.search.FusionRanker;
import io.reminor.core.search.SearchHit;
import io.reminor.core.search.Snippets;
import io.reminor.core.temporal.TemporalQueryResolver;
import io.reminor.core.text.Language;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;

/**
 * Builds the plain-text context block handed to a language model: entries for dates the
 * question names explicitly come first, in full, followed by ranked snippets from other dates.
 */
public final class ContextAssembler {
    static final int RECENT_PREVIEW_LENGTH = 500;
    static final String SNIPPET_SEPARATOR = "\n\n---\n\n";

    private final Language language;
    private final TemporalQueryResolver resolver;
    private final FusionRanker ranker;
    private final EntryStore entries;
    private final RetrievalConfig config;

    public ContextAssembler(
        Language language,
        TemporalQueryResolver resolver,
        FusionRanker ranker,
        EntryStore entries,
        RetrievalConfig config
    ) {
        this.language = Objects.requireNonNull(language, "language must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.ranker = Objects.requireNonNull(ranker, "ranker must not be null");
        this.entries = Objects.requireNonNull(entries, "entries must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public String assemble(String query) {
        return assemble(query, config.maxContextSnippets());
    }

    public String assemble(String query, int maxSnippets) {
        if (maxSnippets < 0) {
            throw new IllegalArgumentException("maxSnippets must be >= 0");
        }
        if (query == null || query.isBlank()) {
            return recent(maxSnippets);
        }

        StringBuilder explicit = new StringBuilder();
        Set<LocalDate> included = new HashSet<>();
        for (LocalDate date : resolver.resolve(query)) {
            Optional<Entry> entry = entries.find(date);
            if (entry.isPresent() && included.add(date)) {
                explicit.append(header(date)).append('\n').append(entry.get().text()).append('\n');
            }
        }

        String similar = render(related(query, maxSnippets, included));
        if (explicit.length() == 0) {
            return similar;
        }
        if (!similar.isEmpty()) {
            explicit.append('\n').append("=== ").append(language.relatedEntriesHeading()).append(" ===\n").append(similar);
        }
        return explicit.toString();
    }

    /** Ranked hits for dates not already included in full. */
    private List<SearchHit> related(String query, int maxSnippets, Set<LocalDate> included) {
        if (maxSnippets == 0) {
            return List.of();
        }
        int limit = (int) Math.min(Integer.MAX_VALUE, (long) maxSnippets + included.size());
        List<SearchHit> hits = new ArrayList<>();
        for (SearchHit hit : ranker.search(query, limit)) {
            if (!included.contains(hit.date()) && hits.size() < maxSnippets) {
                hits.add(hit);
            }
        }
        return hits;
    }

    /** Most recent entries, newest first, each cut to a short preview. */
    public String recent(int count) {
        SortedMap<LocalDate, String> all = entries.entries();
        if (count <= 0 || all.isEmpty()) {
            return "";
        }
        List<LocalDate> dates = new ArrayList<>(all.keySet());
        List<String> blocks = new ArrayList<>();
        for (int i = dates.size() - 1; i >= 0 && blocks.size() < count; i--) {
            LocalDate date = dates.get(i);
            blocks.add(header(date) + "\n" + Snippets.prefix(all.get(date), RECENT_PREVIEW_LENGTH));
        }
        return String.join("\n\n", blocks);
    }

    String render(List<SearchHit> hits) {
        List<String> blocks = new ArrayList<>();
        for (SearchHit hit : hits) {
            blocks.add(String.format(
                Locale.ROOT,
                "[%s] (%s: %.1f)\n%s",
                hit.date(),
                language.relevanceLabel(),
                hit.score(),
                hit.snippet()
            ));
        }
        return String.join(SNIPPET_SEPARATOR, blocks);
    }

    private static String header(LocalDate date) {
        return "=== " + date + " ===";
    }
}
