package com.nayem.tessera.operation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What a create-like operation does when an equivalent object already exists.
 */
public enum DuplicateStrategy {

    /**
     * Report a {@code DuplicateConflict}.
     */
    ERROR,

    /**
     * Resolve to the existing object; the result is {@code reused}.
     */
    REUSE,

    /**
     * Create anyway under the first free {@code Name (n)}; the result is
     * {@code renamed}.
     */
    RENAME;

    @JsonCreator
    public static DuplicateStrategy fromWire(String value) {
        if (value == null) {
            return null;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
