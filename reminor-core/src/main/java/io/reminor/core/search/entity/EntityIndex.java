package io.reminor.core.search.entity;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable inverted index {@code entity -> date -> mentions}. Updates return a new index.
 */
public final class EntityIndex {
    public static final int MIN_TOKEN_LENGTH = 3;
    private static final EntityIndex EMPTY = new EntityIndex(Map.of());

    private final Map<String, Map<LocalDate, Integer>> index;

    private EntityIndex(Map<String, Map<LocalDate, Integer>> index) {
        this.index = index;
    }

    public static EntityIndex empty() {
        return EMPTY;
    }

    static EntityIndex of(Map<String, Map<LocalDate, Integer>> mutable) {
        Map<String, Map<LocalDate, Integer>> frozen = new HashMap<>();
        for (Map.Entry<String, Map<LocalDate, Integer>> entry : mutable.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                frozen.put(entry.getKey(), Collections.unmodifiableMap(new TreeMap<>(entry.getValue())));
            }
        }
        return new EntityIndex(Collections.unmodifiableMap(frozen));
    }

    /**
     * Returns a copy in which {@code date} has exactly the given mentions. Applying the same
     * mentions twice yields an equal index.
     */
    public EntityIndex withEntry(LocalDate date, Map<String, Integer> mentions) {
        Map<String, Map<LocalDate, Integer>> next = new HashMap<>();
        for (Map.Entry<String, Map<LocalDate, Integer>> entry : index.entrySet()) {
            Map<LocalDate, Integer> dates = new HashMap<>(entry.getValue());
            dates.remove(date);
            next.put(entry.getKey(), dates);
        }
        for (Map.Entry<String, Integer> mention : mentions.entrySet()) {
            if (mention.getValue() != null && mention.getValue() > 0) {
                next.computeIfAbsent(mention.getKey(), ignored -> new HashMap<>()).put(date, mention.getValue());
            }
        }
        return of(next);
    }

    /**
     * Sums mention counts per date over every query token (and adjacent token pair) that is a
     * known entity. Tokens shorter than three characters are ignored.
     */
    public Map<LocalDate, Integer> lookup(Collection<String> tokens) {
        Set<String> keys = new LinkedHashSet<>();
        String previous = null;
        for (String token : tokens) {
            if (token == null) {
                continue;
            }
            if (token.length() >= MIN_TOKEN_LENGTH) {
                keys.add(token);
            }
            if (previous != null) {
                keys.add(previous + " " + token);
            }
            previous = token;
        }

        Map<LocalDate, Integer> scores = new LinkedHashMap<>();
        for (String key : keys) {
            Map<LocalDate, Integer> dates = index.get(key);
            if (dates == null) {
                continue;
            }
            dates.forEach((date, count) -> scores.merge(date, count, Integer::sum));
        }
        return scores;
    }

    public Set<String> entities() {
        return index.keySet();
    }

    /** Dates mentioning {@code entity}, oldest first. */
    List<LocalDate> datesFor(String entity) {
        Map<LocalDate, Integer> dates = entity == null ? null : index.get(entity.toLowerCase(Locale.ROOT));
        return dates == null ? List.of() : new ArrayList<>(dates.keySet());
    }

    public Map<LocalDate, Integer> mentions(String entity) {
        Map<LocalDate, Integer> dates = index.get(entity);
        return dates == null ? Map.of() : dates;
    }

    public int size() {
        return index.size();
    }

    public boolean isEmpty() {
        return index.isEmpty();
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof EntityIndex that && index.equals(that.index);
    }

    @Override
    public int hashCode() {
        return index.hashCode();
    }

    @Override
    public String toString() {
        Iterator<String> names = index.keySet().iterator();
        StringBuilder out = new StringBuilder("EntityIndex[");
        for (int i = 0; i < 5 && names.hasNext(); i++) {
            out.append(i == 0 ? "" : ", ").append(names.next());
        }
        return out.append(index.size() > 5 ? ", ...]" : "]").toString();
    }
}
