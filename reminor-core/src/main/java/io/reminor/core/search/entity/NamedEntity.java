package io.reminor.core.search.entity;

public record NamedEntity(String text, EntityType type) {
}
