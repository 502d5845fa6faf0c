package io.reminor.core.search.entity;

import java.util.List;

/**
 * Optional NER collaborator. Only person, place and organization entities are indexed.
 */
public interface NamedEntityRecognizer {
    List<NamedEntity> recognize(String text);
}
