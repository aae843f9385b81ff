package com.nayem.tessera.operation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How operations are grouped into commit units.
 */
public enum ExecutionGranularity {

    /**
     * Pack as many whole operations per chunk as the ceiling allows.
     */
    PER_BATCH_CHUNKING("per-batch-chunking"),

    /**
     * One operation per chunk. Slower, but a rollback never takes more than the
     * failing operation with it.
     */
    PER_OPERATION("per-operation");

    private final String wireName;

    ExecutionGranularity(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ExecutionGranularity fromWire(String value) {
        if (value == null) {
            return null;
        }
        for (ExecutionGranularity granularity : values()) {
            if (granularity.wireName.equalsIgnoreCase(value) || granularity.name().equalsIgnoreCase(value)) {
                return granularity;
            }
        }
        throw new IllegalArgumentException("Unknown execution granularity: " + value);
    }
}
