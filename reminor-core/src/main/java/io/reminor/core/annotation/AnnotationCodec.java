package io.reminor.core.annotation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Field encoding shared by the annotation backends: emotions and insights travel as JSON
 * strings inside the record so either backend can store them as opaque text.
 */
final class AnnotationCodec {
    static final int FORMAT = 1;

    private final ObjectMapper mapper;
    private final AnnotationDecoder decoder;

    AnnotationCodec() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.decoder = new AnnotationDecoder(mapper);
    }

    ObjectMapper mapper() {
        return mapper;
    }

    String encodeEmotions(Map<String, Double> emotions) throws IOException {
        Map<String, Double> clamped = new LinkedHashMap<>();
        if (emotions != null) {
            emotions.forEach((name, score) -> {
                if (name != null && score != null && !score.isNaN()) {
                    clamped.put(name, AnnotationDecoder.clamp(score));
                }
            });
        }
        return write(clamped);
    }

    String encodeInsights(Map<String, Object> insights) throws IOException {
        return write(insights == null ? Map.of() : insights);
    }

    Optional<AnnotationRecord> toRecord(LocalDate date, long revision, Instant updatedAt, String emotions, String insights) {
        Optional<Map<String, Double>> decodedEmotions = decoder.decodeEmotions(emotions);
        if (decodedEmotions.isEmpty()) {
            return Optional.empty();
        }
        return decoder.decodeInsights(insights)
            .map(decodedInsights -> new AnnotationRecord(date, decodedEmotions.get(), decodedInsights, revision, updatedAt));
    }

    /** Raw text of a field that may hold either an encoded string or an inline object. */
    static String rawField(JsonNode envelope, String name) {
        JsonNode node = envelope.get(name);
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return node.isTextual() ? node.asText() : node.toString();
    }

    private String write(Object value) throws IOException {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IOException("Failed to encode annotation field", e);
        }
    }
}
