package com.nayem.tessera.tempid;

import com.fasterxml.jackson.annotation.JsonValue;
import com.nayem.tessera.model.ObjectKind;

import java.util.Locale;

/**
 * What a tempId stands for. Reported to clients next to each resolved id.
 */
public enum MappingKind {
    CONCEPT,
    VISUAL,
    CONNECTION,
    VIEW,
    FOLDER;

    public static MappingKind of(ObjectKind kind) {
        return switch (kind) {
            case ELEMENT, RELATIONSHIP -> CONCEPT;
            case DIAGRAM_OBJECT -> VISUAL;
            case CONNECTION -> CONNECTION;
            case VIEW -> VIEW;
            case FOLDER -> FOLDER;
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
