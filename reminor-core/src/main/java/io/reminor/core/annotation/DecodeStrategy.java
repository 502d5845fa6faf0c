package io.reminor.core.annotation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;

/**
 * One attempt at turning a stored JSON field back into an object node.
 */
@FunctionalInterface
public interface DecodeStrategy {
    Optional<JsonNode> decode(String raw, ObjectMapper mapper);
}
