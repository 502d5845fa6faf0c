package io.reminor.core.search.entity;

import io.reminor.core.text.TextTokens;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects entity tokens from three sources: recognizer-provided person/place/organization
 * entities, capitalized words that are not function or calendar words, and a fixed domain
 * vocabulary.
 */
public final class HeuristicEntityExtractor implements EntityExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(HeuristicEntityExtractor.class);
    private static final Pattern CAPITALIZED = Pattern.compile(
        "\\b\\p{Lu}\\p{L}{2,}\\b",
        Pattern.UNICODE_CHARACTER_CLASS
    );
    private static final Set<EntityType> INDEXED_TYPES = EnumSet.of(EntityType.PERSON, EntityType.PLACE, EntityType.ORGANIZATION);

    private final Optional<NamedEntityRecognizer> recognizer;
    private final Set<String> vocabulary;

    public HeuristicEntityExtractor(Optional<NamedEntityRecognizer> recognizer, Collection<String> vocabulary) {
        this.recognizer = Objects.requireNonNull(recognizer, "recognizer must not be null");
        Set<String> normalized = new LinkedHashSet<>();
        if (vocabulary != null) {
            for (String word : vocabulary) {
                if (word != null && !word.isBlank()) {
                    normalized.add(word.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        this.vocabulary = Set.copyOf(normalized);
    }

    @Override
    public Map<String, Integer> extract(String text) {
        if (text == null || text.isBlank()) {
            return Map.of();
        }
        Set<String> entities = new LinkedHashSet<>();
        recognizer.ifPresent(ner -> entities.addAll(recognized(ner, text)));

        Matcher matcher = CAPITALIZED.matcher(text);
        while (matcher.find()) {
            String word = matcher.group().toLowerCase(Locale.ROOT);
            if (!TextTokens.isStopword(word) && !TextTokens.isCalendarWord(word)) {
                entities.add(word);
            }
        }

        String lowered = text.toLowerCase(Locale.ROOT);
        for (String word : vocabulary) {
            if (lowered.contains(word)) {
                entities.add(word);
            }
        }

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String entity : entities) {
            counts.put(entity, Math.max(1, mentions(lowered, entity)));
        }
        return counts;
    }

    private Set<String> recognized(NamedEntityRecognizer ner, String text) {
        Set<String> out = new LinkedHashSet<>();
        try {
            List<NamedEntity> found = ner.recognize(text);
            if (found == null) {
                return out;
            }
            for (NamedEntity entity : found) {
                if (entity == null || entity.text() == null || !INDEXED_TYPES.contains(entity.type())) {
                    continue;
                }
                String normalized = entity.text().trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
                if (normalized.length() >= 3) {
                    out.add(normalized);
                }
            }
        } catch (RuntimeException e) {
            LOG.warn("Named entity recognizer failed, using heuristics only: {}", e.getMessage());
        }
        return out;
    }

    private int mentions(String lowered, String entity) {
        Matcher matcher = Pattern.compile(
            "(?<![\\p{L}\\p{N}])" + Pattern.quote(entity) + "(?![\\p{L}\\p{N}])",
            Pattern.UNICODE_CHARACTER_CLASS
        ).matcher(lowered);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
