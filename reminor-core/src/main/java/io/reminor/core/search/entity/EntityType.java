package io.reminor.core.search.entity;

public enum EntityType {
    PERSON,
    PLACE,
    ORGANIZATION,
    OTHER
}
