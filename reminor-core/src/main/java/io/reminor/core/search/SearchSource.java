package io.reminor.core.search;

public enum SearchSource {
    LEXICAL,
    SEMANTIC,
    DIRECT,
    ENTITY
}
