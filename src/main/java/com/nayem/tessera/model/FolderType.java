package com.nayem.tessera.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Top-level folders every model owns. Elements land in the folder of their
 * layer unless a folder is given explicitly.
 */
public enum FolderType {
    STRATEGY("Strategy"),
    BUSINESS("Business"),
    APPLICATION("Application"),
    TECHNOLOGY("Technology & Physical"),
    MOTIVATION("Motivation"),
    IMPLEMENTATION_MIGRATION("Implementation & Migration"),
    OTHER("Other"),
    RELATIONS("Relations"),
    VIEWS("Views");

    private final String displayName;

    FolderType(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Accepts enum names in any case, with dashes or spaces as separators.
     */
    public static Optional<FolderType> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        if (normalized.equals("IMPLEMENTATION_AND_MIGRATION")) {
            normalized = IMPLEMENTATION_MIGRATION.name();
        }
        for (FolderType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
