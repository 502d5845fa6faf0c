package io.reminor.core.search.lexical;

import io.reminor.core.search.Snippets;
import io.reminor.core.text.TextTokens;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * In-process BM25 index. Each mutation publishes a new immutable snapshot so readers never
 * observe a half-applied batch.
 */
public final class Bm25LexicalIndex implements LexicalSearchProvider {
    private static final int SNIPPET_LENGTH = 240;

    private final double k1;
    private final double b;
    private volatile Snapshot snapshot = Snapshot.EMPTY;

    public Bm25LexicalIndex() {
        this(1.2, 0.75);
    }

    public Bm25LexicalIndex(double k1, double b) {
        this.k1 = k1;
        this.b = b;
    }

    @Override
    public synchronized void put(LexicalDocument document) {
        putMany(List.of(document));
    }

    @Override
    public synchronized void putMany(List<LexicalDocument> documents) {
        Map<String, Doc> docs = new LinkedHashMap<>(snapshot.docs);
        for (LexicalDocument document : documents) {
            docs.put(document.title(), Doc.of(document));
        }
        snapshot = Snapshot.of(docs);
    }

    @Override
    public synchronized void clear() {
        snapshot = Snapshot.EMPTY;
    }

    @Override
    public List<LexicalHit> find(String query, int k) {
        Snapshot current = snapshot;
        if (query == null || query.isBlank() || k <= 0 || current.docs.isEmpty()) {
            return List.of();
        }

        Set<String> terms = new HashSet<>(TextTokens.keywords(query, 2));
        int n = current.docs.size();
        List<LexicalHit> hits = new ArrayList<>();
        for (Doc doc : current.docs.values()) {
            double score = 0.0;
            String firstTerm = null;
            for (String term : terms) {
                int frequency = doc.termFrequencies.getOrDefault(term, 0);
                if (frequency == 0) {
                    continue;
                }
                if (firstTerm == null) {
                    firstTerm = term;
                }
                int documentFrequency = current.documentFrequencies.getOrDefault(term, 0);
                double idf = Math.log(1.0 + (n - documentFrequency + 0.5) / (documentFrequency + 0.5));
                double norm = frequency + k1 * (1 - b + b * (doc.length / Math.max(1e-9, current.averageLength)));
                score += idf * (frequency * (k1 + 1)) / Math.max(1e-9, norm);
            }
            if (score > 0.0) {
                hits.add(new LexicalHit(doc.title, snippet(doc.text, firstTerm), score));
            }
        }
        hits.sort((left, right) -> Double.compare(right.score(), left.score()));
        return hits.size() > k ? List.copyOf(hits.subList(0, k)) : hits;
    }

    public int size() {
        return snapshot.docs.size();
    }

    private String snippet(String text, String term) {
        int index = term == null ? 0 : text.toLowerCase(Locale.ROOT).indexOf(term);
        return Snippets.around(text, Math.max(0, index), SNIPPET_LENGTH / 4, SNIPPET_LENGTH);
    }

    private static final class Doc {
        private final String title;
        private final String text;
        private final Map<String, Integer> termFrequencies;
        private final int length;

        private Doc(String title, String text, Map<String, Integer> termFrequencies, int length) {
            this.title = title;
            this.text = text;
            this.termFrequencies = termFrequencies;
            this.length = length;
        }

        static Doc of(LexicalDocument document) {
            List<String> tokens = TextTokens.keywords(document.text(), 2);
            Map<String, Integer> tf = new HashMap<>();
            for (String token : tokens) {
                tf.merge(token, 1, Integer::sum);
            }
            return new Doc(document.title(), document.text(), Map.copyOf(tf), tokens.size());
        }
    }

    private static final class Snapshot {
        static final Snapshot EMPTY = new Snapshot(Map.of(), Map.of(), 0.0);

        private final Map<String, Doc> docs;
        private final Map<String, Integer> documentFrequencies;
        private final double averageLength;

        private Snapshot(Map<String, Doc> docs, Map<String, Integer> documentFrequencies, double averageLength) {
            this.docs = docs;
            this.documentFrequencies = documentFrequencies;
            this.averageLength = averageLength;
        }

        static Snapshot of(Map<String, Doc> docs) {
            Map<String, Integer> df = new HashMap<>();
            double totalLength = 0.0;
            for (Doc doc : docs.values()) {
                totalLength += doc.length;
                for (String term : doc.termFrequencies.keySet()) {
                    df.merge(term, 1, Integer::sum);
                }
            }
            double average = docs.isEmpty() ? 0.0 : totalLength / docs.size();
            return new Snapshot(Map.copyOf(docs), Map.copyOf(df), average);
        }
    }
}
