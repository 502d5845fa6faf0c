package io.reminor.core.engine;

public record EngineStatus(int entries, int entities, boolean semanticEnabled, int vectors, boolean lexicalEnabled) {
}
