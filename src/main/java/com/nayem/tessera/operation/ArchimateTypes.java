package com.nayem.tessera.operation;

import com.nayem.tessera.model.FolderType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Known element and relationship types, in kebab-case, with the folder each
 * element type lives in by default.
 */
public final class ArchimateTypes {

    private static final Map<String, FolderType> ELEMENT_FOLDERS;

    private static final Set<String> RELATIONSHIP_TYPES = Set.of(
            "composition-relationship", "aggregation-relationship", "assignment-relationship",
            "realization-relationship", "serving-relationship", "access-relationship",
            "influence-relationship", "triggering-relationship", "flow-relationship",
            "specialization-relationship", "association-relationship");

    static {
        Map<String, FolderType> folders = new LinkedHashMap<>();
        for (String type : new String[] { "resource", "capability", "value-stream", "course-of-action" }) {
            folders.put(type, FolderType.STRATEGY);
        }
        for (String type : new String[] { "business-actor", "business-role", "business-collaboration",
                "business-interface", "business-process", "business-function", "business-interaction",
                "business-event", "business-service", "business-object", "contract", "representation",
                "product" }) {
            folders.put(type, FolderType.BUSINESS);
        }
        for (String type : new String[] { "application-component", "application-collaboration",
                "application-interface", "application-function", "application-interaction",
                "application-process", "application-event", "application-service", "data-object" }) {
            folders.put(type, FolderType.APPLICATION);
        }
        for (String type : new String[] { "node", "device", "system-software", "technology-collaboration",
                "technology-interface", "path", "communication-network", "technology-function",
                "technology-process", "technology-interaction", "technology-event", "technology-service",
                "artifact", "equipment", "facility", "distribution-network", "material" }) {
            folders.put(type, FolderType.TECHNOLOGY);
        }
        for (String type : new String[] { "stakeholder", "driver", "assessment", "goal", "outcome",
                "principle", "requirement", "constraint", "meaning", "value" }) {
            folders.put(type, FolderType.MOTIVATION);
        }
        for (String type : new String[] { "work-package", "deliverable", "implementation-event", "plateau",
                "gap" }) {
            folders.put(type, FolderType.IMPLEMENTATION_MIGRATION);
        }
        for (String type : new String[] { "location", "grouping", "junction" }) {
            folders.put(type, FolderType.OTHER);
        }
        ELEMENT_FOLDERS = Collections.unmodifiableMap(folders);
    }

    private ArchimateTypes() {
    }

    public static boolean isElementType(String type) {
        return type != null && ELEMENT_FOLDERS.containsKey(type);
    }

    public static boolean isRelationshipType(String type) {
        return type != null && RELATIONSHIP_TYPES.contains(type);
    }

    public static Optional<FolderType> defaultFolder(String elementType) {
        return Optional.ofNullable(ELEMENT_FOLDERS.get(elementType));
    }
}
