package io.reminor.core.engine;

public enum ImportStatus {
    SUCCESS,
    SKIPPED,
    ERROR
}
