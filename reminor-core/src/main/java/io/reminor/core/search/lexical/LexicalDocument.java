package io.reminor.core.search.lexical;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Document handed to a lexical engine. The title carries the entry date so hits can be
 * mapped back to the journal.
 */
public record LexicalDocument(String title, String text) {

    public LexicalDocument {
        Objects.requireNonNull(title, "title must not be null");
        text = text == null ? "" : text;
    }

    public static LexicalDocument forEntry(LocalDate date, String text) {
        return new LexicalDocument(LexicalHit.TITLE_PREFIX + date, text);
    }
}
