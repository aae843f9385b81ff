package com.nayem.tessera.operation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of a single operation.
 */
public enum OperationStatus {
    CREATED,
    REUSED,
    RENAMED,
    UPDATED,
    DELETED,
    MOVED,
    ADDED,
    NESTED,
    STYLED,
    SKIPPED,
    /**
     * Never applied: its chunk was rolled back, or the job stopped before
     * reaching it.
     */
    UNEXECUTED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Whether the operation took effect, including resolutions to existing
     * objects.
     */
    public boolean executed() {
        return this != SKIPPED && this != UNEXECUTED;
    }
}
