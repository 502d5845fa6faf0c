package io.reminor.core.search;

import io.reminor.core.config.model.RetrievalConfig;
import io.reminor.core.journal.EntryStore;
import io.reminor.core.text.TextTokens;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keyword substring scan over every entry. Slow but exhaustive, and the only strategy that
 * understands "what did I do in June".
 */
public final class DirectTextMatcher {
    static final int MIN_KEYWORD_LENGTH = 3;
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    // "may" is far more often the modal verb than the month.
    private static final Set<String> AMBIGUOUS_MONTHS = Set.of("may");

    private final EntryStore entries;
    private final RetrievalConfig config;

    public DirectTextMatcher(EntryStore entries, RetrievalConfig config) {
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
        String cleaned = PUNCTUATION.matcher(query.toLowerCase(Locale.ROOT)).replaceAll(" ");
        Set<String> keywords = new LinkedHashSet<>();
        Set<Integer> months = new LinkedHashSet<>();
        for (String token : cleaned.trim().split("\\s+")) {
            if (token.length() < MIN_KEYWORD_LENGTH) {
                continue;
            }
            int month = AMBIGUOUS_MONTHS.contains(token) ? 0 : TextTokens.monthNumber(token);
            if (month > 0) {
                months.add(month);
                keywords.add(token);
            } else if (!TextTokens.isStopword(token)) {
                keywords.add(token);
            }
        }
        if (keywords.isEmpty()) {
            return List.of();
        }

        List<SearchHit> hits = new ArrayList<>();
        for (Map.Entry<LocalDate, String> entry : entries.entries().entrySet()) {
            SearchHit hit = score(entry.getKey(), entry.getValue(), keywords, months);
            if (hit != null) {
                hits.add(hit);
            }
        }
        hits.sort(Comparator.comparingDouble(SearchHit::score).reversed()
            .thenComparing(SearchHit::date, Comparator.reverseOrder()));
        return hits.size() > limit ? List.copyOf(hits.subList(0, limit)) : List.copyOf(hits);
    }

    private SearchHit score(LocalDate date, String text, Set<String> keywords, Set<Integer> months) {
        String lowered = text.toLowerCase(Locale.ROOT);
        boolean monthMatch = months.contains(date.getMonthValue());
        double score = monthMatch ? config.monthBonus() : 0.0;
        String best = null;
        double bestScore = 0.0;
        for (String keyword : keywords) {
            int occurrences = TextTokens.countOccurrences(lowered, keyword);
            if (occurrences == 0) {
                continue;
            }
            double keywordScore = occurrences * (5.0 + keyword.length());
            score += keywordScore;
            if (keywordScore > bestScore) {
                bestScore = keywordScore;
                best = keyword;
            }
        }
        if (!monthMatch && best == null) {
            return null;
        }
        String snippet = best == null
            ? Snippets.prefix(text, config.snippetWindow())
            : Snippets.around(text, lowered.indexOf(best), config.snippetLead(), config.snippetWindow());
        return new SearchHit(date, snippet, score, SearchSource.DIRECT);
    }
}
