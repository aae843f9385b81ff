package com.nayem.tessera.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only access to the committed model.
 * <p>
 * Implementations only need {@link #findById} and {@link #findAll}; the
 * remaining lookups are derived from them and may be overridden with indexed
 * versions.
 * </p>
 */
public interface ModelReader {

    Optional<ModelObject> findById(String id);

    /**
     * All committed objects of the given kind, in a stable order.
     */
    List<ModelObject> findAll(ObjectKind kind);

    default List<ModelObject> findMatches(MatchCriteria criteria) {
        return findAll(criteria.kind()).stream()
                .filter(criteria::matches)
                .toList();
    }

    default Optional<ModelObject> findRootFolder(FolderType type) {
        return findAll(ObjectKind.FOLDER).stream()
                .filter(folder -> folder.containerId() == null)
                .filter(folder -> type.name().equals(folder.type()))
                .findFirst();
    }

    default Optional<ModelObject> findFolderByName(String name) {
        return findAll(ObjectKind.FOLDER).stream()
                .filter(folder -> name.equals(folder.name()))
                .findFirst();
    }

    /**
     * Diagram objects in {@code viewId} (at any nesting depth) that reference the
     * concept.
     */
    default List<ModelObject> findVisualsForConcept(String viewId, String conceptId) {
        return findAll(ObjectKind.DIAGRAM_OBJECT).stream()
                .filter(visual -> viewId == null || viewId.equals(visual.viewId()))
                .filter(visual -> conceptId.equals(visual.conceptId()))
                .toList();
    }

    /**
     * Connections drawing the relationship, in one view or, with a null
     * {@code viewId}, in all views.
     */
    default List<ModelObject> findConnectionsForRelationship(String viewId, String relationshipId) {
        return findAll(ObjectKind.CONNECTION).stream()
                .filter(connection -> viewId == null || viewId.equals(connection.viewId()))
                .filter(connection -> relationshipId.equals(connection.conceptId()))
                .toList();
    }

    default List<ModelObject> findRelationshipsAttachedTo(String elementId) {
        return findAll(ObjectKind.RELATIONSHIP).stream()
                .filter(rel -> elementId.equals(rel.sourceId()) || elementId.equals(rel.targetId()))
                .toList();
    }

    default boolean exists(String id) {
        return id != null && findById(Objects.requireNonNull(id)).isPresent();
    }
}
