package io.reminor.core.annotation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes the JSON-encoded emotion and insight fields of a stored annotation.
 *
 * <p>Older writers sometimes encoded an already encoded string, so a field can arrive as
 * {@code "{\"felice\": 0.8}"} or with stray escaped quotes. Strategies are tried in order
 * and the first object wins.
 */
public final class AnnotationDecoder {
    private static final Logger LOG = LoggerFactory.getLogger(AnnotationDecoder.class);
    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {
    };

    static final DecodeStrategy STRICT = (raw, mapper) -> readObject(raw, mapper);

    static final DecodeStrategy UNWRAP_STRING = (raw, mapper) -> {
        JsonNode node = readTree(raw, mapper);
        if (node == null || !node.isTextual()) {
            return Optional.empty();
        }
        return readObject(node.asText(), mapper);
    };

    static final DecodeStrategy STRIP_QUOTES = (raw, mapper) -> {
        String cleaned = raw.trim();
        while (cleaned.startsWith("\"")) {
            cleaned = cleaned.substring(1);
        }
        while (cleaned.endsWith("\"")) {
            cleaned = cleaned.substring(0, cleaned.length() - 1);
        }
        return readObject(cleaned.replace("\\\"", "\""), mapper);
    };

    private final ObjectMapper mapper;
    private final List<DecodeStrategy> strategies;

    public AnnotationDecoder(ObjectMapper mapper) {
        this(mapper, List.of(STRICT, UNWRAP_STRING, STRIP_QUOTES));
    }

    public AnnotationDecoder(ObjectMapper mapper, List<DecodeStrategy> strategies) {
        this.mapper = mapper;
        this.strategies = List.copyOf(strategies);
    }

    public Optional<JsonNode> decode(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        for (DecodeStrategy strategy : strategies) {
            Optional<JsonNode> decoded = strategy.decode(raw, mapper);
            if (decoded.isPresent()) {
                return decoded;
            }
        }
        LOG.warn("Undecodable annotation field: {}", abbreviate(raw));
        return Optional.empty();
    }

    /** Emotion scores clamped to {@code [0, 1]}; non-numeric values are dropped. */
    public Optional<Map<String, Double>> decodeEmotions(String raw) {
        return decode(raw).map(node -> {
            Map<String, Double> emotions = new LinkedHashMap<>();
            node.fields().forEachRemaining(field -> {
                JsonNode value = field.getValue();
                Double score = null;
                if (value.isNumber()) {
                    score = value.asDouble();
                } else if (value.isTextual()) {
                    try {
                        score = Double.parseDouble(value.asText().trim());
                    } catch (NumberFormatException ignored) {
                        LOG.debug("Dropping non-numeric emotion {}={}", field.getKey(), value.asText());
                    }
                }
                if (score != null && !score.isNaN()) {
                    emotions.put(field.getKey(), clamp(score));
                }
            });
            return emotions;
        });
    }

    /** Insights as a plain map. A missing field decodes to an empty map. */
    public Optional<Map<String, Object>> decodeInsights(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.of(Map.of());
        }
        return decode(raw).map(node -> mapper.convertValue(node, OBJECT_MAP));
    }

    public static double clamp(double score) {
        return Math.max(0.0, Math.min(1.0, score));
    }

    private static Optional<JsonNode> readObject(String raw, ObjectMapper mapper) {
        JsonNode node = readTree(raw, mapper);
        return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
    }

    private static JsonNode readTree(String raw, ObjectMapper mapper) {
        try {
            return mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static String abbreviate(String raw) {
        return raw.length() <= 80 ? raw : raw.substring(0, 80) + "...";
    }
}
