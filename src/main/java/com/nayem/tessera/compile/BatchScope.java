package com.nayem.tessera.compile;

import com.nayem.tessera.model.MatchCriteria;
import com.nayem.tessera.model.ModelObject;
import com.nayem.tessera.model.ModelReader;
import com.nayem.tessera.model.ObjectKind;
import com.nayem.tessera.model.ObjectRef;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The model as compilation sees it: committed state overlaid with the objects
 * earlier operations of the same batch will create or remove.
 * <p>
 * Job-scoped and single-threaded.
 * </p>
 */
class BatchScope {

    private final ModelReader model;
    private final List<KnownObject> pending = new ArrayList<>();
    private final Set<ObjectRef> removed = new HashSet<>();

    BatchScope(ModelReader model) {
        this.model = model;
    }

    ModelReader model() {
        return model;
    }

    void created(KnownObject object) {
        pending.add(object);
    }

    void removed(ObjectRef ref) {
        removed.add(ref);
    }

    boolean isRemoved(ObjectRef ref) {
        return removed.contains(ref);
    }

    Optional<KnownObject> describe(ObjectRef ref) {
        if (ref == null || removed.contains(ref)) {
            return Optional.empty();
        }
        if (ref instanceof ObjectRef.Committed committed) {
            return model.findById(committed.id()).map(KnownObject::of);
        }
        return pending.stream().filter(object -> object.ref().equals(ref)).findFirst();
    }

    List<KnownObject> matchElements(String type, String name) {
        List<KnownObject> matches = new ArrayList<>();
        for (ModelObject object : model.findMatches(MatchCriteria.element(type, name))) {
            addIfLive(matches, KnownObject.of(object));
        }
        for (KnownObject object : pending) {
            if (object.kind() == ObjectKind.ELEMENT && Objects.equals(type, object.type())
                    && Objects.equals(name, object.name())) {
                addIfLive(matches, object);
            }
        }
        return matches;
    }

    /**
     * Relationships with the given signature. {@code accessType} and
     * {@code strength} are wildcards when null.
     */
    List<KnownObject> matchRelationships(String type, ObjectRef source, ObjectRef target, String accessType,
            String strength) {
        List<KnownObject> matches = new ArrayList<>();
        if (source instanceof ObjectRef.Committed s && target instanceof ObjectRef.Committed t) {
            MatchCriteria criteria = MatchCriteria.relationship(type, s.id(), t.id())
                    .withQualifiers(accessType, strength);
            for (ModelObject object : model.findMatches(criteria)) {
                addIfLive(matches, KnownObject.of(object));
            }
        }
        for (KnownObject object : pending) {
            if (object.kind() == ObjectKind.RELATIONSHIP && Objects.equals(type, object.type())
                    && source.equals(object.source()) && target.equals(object.target())
                    && (accessType == null || accessType.equals(object.accessType()))
                    && (strength == null || strength.equals(object.strength()))) {
                addIfLive(matches, object);
            }
        }
        return matches;
    }

    /**
     * Names already taken by elements of {@code type}, committed or pending.
     */
    Set<String> elementNames(String type) {
        Set<String> names = new LinkedHashSet<>();
        model.findMatches(MatchCriteria.element(type, null)).stream()
                .filter(object -> !removed.contains(ObjectRef.committed(object.id())))
                .map(ModelObject::name)
                .filter(Objects::nonNull)
                .forEach(names::add);
        pending.stream()
                .filter(object -> object.kind() == ObjectKind.ELEMENT && type.equals(object.type()))
                .filter(object -> !removed.contains(object.ref()))
                .map(KnownObject::name)
                .filter(Objects::nonNull)
                .forEach(names::add);
        return names;
    }

    /**
     * Diagram objects in {@code view} that reference {@code concept}.
     */
    List<KnownObject> visualsFor(ObjectRef view, ObjectRef concept) {
        List<KnownObject> matches = new ArrayList<>();
        if (view instanceof ObjectRef.Committed v && concept instanceof ObjectRef.Committed c) {
            for (ModelObject object : model.findVisualsForConcept(v.id(), c.id())) {
                addIfLive(matches, KnownObject.of(object));
            }
        }
        for (KnownObject object : pending) {
            if (object.kind() == ObjectKind.DIAGRAM_OBJECT && view.equals(object.view())
                    && concept.equals(object.concept())) {
                addIfLive(matches, object);
            }
        }
        return matches;
    }

    /**
     * Connections drawing {@code relationship}. A null view means all views.
     */
    List<KnownObject> connectionsFor(ObjectRef view, ObjectRef relationship) {
        List<KnownObject> matches = new ArrayList<>();
        if (relationship instanceof ObjectRef.Committed r) {
            String viewId = view instanceof ObjectRef.Committed v ? v.id() : null;
            if (view == null || viewId != null) {
                for (ModelObject object : model.findConnectionsForRelationship(viewId, r.id())) {
                    addIfLive(matches, KnownObject.of(object));
                }
            }
        }
        for (KnownObject object : pending) {
            if (object.kind() == ObjectKind.CONNECTION && relationship.equals(object.concept())
                    && (view == null || view.equals(object.view()))) {
                addIfLive(matches, object);
            }
        }
        return matches;
    }

    List<KnownObject> relationshipsAttachedTo(ObjectRef element) {
        List<KnownObject> matches = new ArrayList<>();
        if (element instanceof ObjectRef.Committed e) {
            for (ModelObject object : model.findRelationshipsAttachedTo(e.id())) {
                addIfLive(matches, KnownObject.of(object));
            }
        }
        for (KnownObject object : pending) {
            if (object.kind() == ObjectKind.RELATIONSHIP
                    && (element.equals(object.source()) || element.equals(object.target()))) {
                addIfLive(matches, object);
            }
        }
        return matches;
    }

    /**
     * Diagram objects in any view that reference {@code concept}.
     */
    List<KnownObject> visualsReferencing(ObjectRef concept) {
        List<KnownObject> matches = new ArrayList<>();
        if (concept instanceof ObjectRef.Committed c) {
            for (ModelObject object : model.findVisualsForConcept(null, c.id())) {
                addIfLive(matches, KnownObject.of(object));
            }
        }
        for (KnownObject object : pending) {
            if (object.kind() == ObjectKind.DIAGRAM_OBJECT && concept.equals(object.concept())) {
                addIfLive(matches, object);
            }
        }
        return matches;
    }

    private void addIfLive(List<KnownObject> matches, KnownObject object) {
        if (!removed.contains(object.ref()) && matches.stream().noneMatch(m -> m.ref().equals(object.ref()))) {
            matches.add(object);
        }
    }
}
