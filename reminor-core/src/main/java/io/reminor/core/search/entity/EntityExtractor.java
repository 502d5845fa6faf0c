package io.reminor.core.search.entity;

import java.util.Map;

public interface EntityExtractor {
    /**
     * @return lower-cased entity token to number of mentions in {@code text}; never contains
     *     zero counts
     */
    Map<String, Integer> extract(String text);
}
