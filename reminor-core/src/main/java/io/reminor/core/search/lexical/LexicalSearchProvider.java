package io.reminor.core.search.lexical;

import java.io.IOException;
import java.util.List;

/**
 * Term-ranked full-text engine. Documents are keyed by title; putting a document with an
 * existing title replaces it.
 */
public interface LexicalSearchProvider {
    void put(LexicalDocument document) throws IOException;

    void putMany(List<LexicalDocument> documents) throws IOException;

    List<LexicalHit> find(String query, int k) throws IOException;

    void clear() throws IOException;
}
