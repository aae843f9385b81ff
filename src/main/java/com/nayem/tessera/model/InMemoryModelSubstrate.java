package com.nayem.tessera.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of ModelSubstrate.
 * <p>
 * Suitable for:
 * - Development and testing
 * - Hosts that keep the whole model in this process
 * </p>
 * <p>
 * Mirrors the behaviour of the real command stack: provisional objects get
 * their final id only when a commit attaches them, and units above the
 * configured ceiling are silently discarded while still reporting success.
 * </p>
 */
public class InMemoryModelSubstrate implements ModelSubstrate {

    private static final Logger log = LoggerFactory.getLogger(InMemoryModelSubstrate.class);

    private final int silentRollbackAbove;
    private final AtomicLong handles = new AtomicLong();
    private final AtomicLong idSequence = new AtomicLong();
    private final AtomicInteger commitCount = new AtomicInteger();
    private final Map<Long, String> committedIds = new HashMap<>();

    // Replaced wholesale on every successful commit; published nodes are never mutated.
    private volatile Map<String, Node> objects;

    public InMemoryModelSubstrate() {
        this(0);
    }

    /**
     * @param silentRollbackAbove units with more primitives than this are
     *                            dropped without error; 0 disables the ceiling
     */
    public InMemoryModelSubstrate(int silentRollbackAbove) {
        this.silentRollbackAbove = silentRollbackAbove;
        Map<String, Node> initial = new LinkedHashMap<>();
        for (FolderType type : FolderType.values()) {
            Node folder = new Node("folder-" + type.name().toLowerCase().replace('_', '-'), ObjectKind.FOLDER,
                    type.name());
            folder.name = type.displayName();
            initial.put(folder.id, folder);
        }
        this.objects = initial;
    }

    @Override
    public ProvisionalObject instantiateConcept(ObjectKind kind, String type) {
        long handle = handles.incrementAndGet();
        return new ProvisionalObject(handle, kind, type, "tmp-" + handle);
    }

    @Override
    public synchronized CommitOutcome commit(CommitUnit unit) {
        commitCount.incrementAndGet();
        if (silentRollbackAbove > 0 && unit.size() > silentRollbackAbove) {
            log.debug("Discarding unit '{}' with {} primitives (ceiling {})", unit.label(), unit.size(),
                    silentRollbackAbove);
            return CommitOutcome.success();
        }

        Map<String, Node> working = new LinkedHashMap<>();
        objects.forEach((id, node) -> working.put(id, node.copy()));
        Map<Long, String> assigned = new HashMap<>();

        try {
            for (Primitive primitive : unit.primitives()) {
                apply(primitive, working, assigned);
            }
        } catch (IllegalStateException e) {
            log.debug("Rolling back unit '{}': {}", unit.label(), e.getMessage());
            return CommitOutcome.rolledBack(e.getMessage());
        }

        committedIds.putAll(assigned);
        objects = working;
        return CommitOutcome.success();
    }

    @Override
    public synchronized Map<ProvisionalObject, ModelObject> readCommittedState(
            Collection<ProvisionalObject> provisionals) {
        Map<String, Node> snapshot = objects;
        Map<ProvisionalObject, ModelObject> result = new LinkedHashMap<>();
        for (ProvisionalObject provisional : provisionals) {
            String id = committedIds.get(provisional.handle());
            if (id != null && snapshot.containsKey(id)) {
                result.put(provisional, snapshot(snapshot.get(id), snapshot));
            }
        }
        return result;
    }

    @Override
    public Optional<ModelObject> findById(String id) {
        Map<String, Node> snapshot = objects;
        Node node = snapshot.get(id);
        return node == null ? Optional.empty() : Optional.of(snapshot(node, snapshot));
    }

    @Override
    public List<ModelObject> findAll(ObjectKind kind) {
        Map<String, Node> snapshot = objects;
        List<ModelObject> result = new ArrayList<>();
        for (Node node : snapshot.values()) {
            if (node.kind == kind) {
                result.add(snapshot(node, snapshot));
            }
        }
        return result;
    }

    /**
     * Number of commit calls, including discarded and rolled back ones.
     */
    public int commitCount() {
        return commitCount.get();
    }

    /**
     * Number of committed objects, root folders included.
     */
    public int size() {
        return objects.size();
    }

    private void apply(Primitive primitive, Map<String, Node> working, Map<Long, String> assigned) {
        if (primitive instanceof Primitive.SetField setField) {
            Node node = resolve(setField.target(), working, assigned);
            applyField(node, setField.field(), setField.value(), working, assigned);
        } else if (primitive instanceof Primitive.SetProperty setProperty) {
            Node node = resolve(setProperty.target(), working, assigned);
            if (setProperty.value() == null) {
                node.properties.remove(setProperty.key());
            } else {
                node.properties.put(setProperty.key(), setProperty.value());
            }
        } else if (primitive instanceof Primitive.AddToFolder addToFolder) {
            Node node = resolve(addToFolder.object(), working, assigned);
            Node folder = resolve(addToFolder.folder(), working, assigned);
            if (folder.kind != ObjectKind.FOLDER) {
                throw new IllegalStateException(folder.id + " is not a folder");
            }
            node.containerId = folder.id;
        } else if (primitive instanceof Primitive.AddToView addToView) {
            Node node = resolve(addToView.object(), working, assigned);
            Node container = resolve(addToView.container(), working, assigned);
            if (container.kind != ObjectKind.VIEW && container.kind != ObjectKind.DIAGRAM_OBJECT) {
                throw new IllegalStateException(container.id + " cannot contain diagram objects");
            }
            node.containerId = container.id;
        } else if (primitive instanceof Primitive.Remove remove) {
            String id = idOf(remove.target(), assigned);
            if (id != null && working.containsKey(id)) {
                removeTree(id, working);
            }
        } else {
            throw new IllegalStateException("Primitive is not executable: " + primitive);
        }
    }

    private void applyField(Node node, String field, Object value, Map<String, Node> working,
            Map<Long, String> assigned) {
        switch (field) {
            case Fields.NAME -> node.name = (String) value;
            case Fields.SOURCE -> node.sourceId = referencedId(value, working, assigned);
            case Fields.TARGET -> node.targetId = referencedId(value, working, assigned);
            case Fields.CONCEPT -> node.conceptId = referencedId(value, working, assigned);
            case Fields.BOUNDS -> {
                Bounds current = (Bounds) node.attributes.get(Fields.BOUNDS);
                Bounds patch = (Bounds) value;
                node.attributes.put(Fields.BOUNDS, current == null ? patch : current.merge(patch));
            }
            default -> {
                if (value == null) {
                    node.attributes.remove(field);
                } else {
                    node.attributes.put(field, value);
                }
            }
        }
    }

    private String referencedId(Object value, Map<String, Node> working, Map<Long, String> assigned) {
        if (!(value instanceof ObjectRef ref)) {
            throw new IllegalStateException("Reference field expects an object reference, got " + value);
        }
        return resolve(ref, working, assigned).id;
    }

    private Node resolve(ObjectRef ref, Map<String, Node> working, Map<Long, String> assigned) {
        if (ref instanceof ObjectRef.Committed committed) {
            Node node = working.get(committed.id());
            if (node == null) {
                throw new IllegalStateException("Unknown object " + committed.id());
            }
            return node;
        }
        ProvisionalObject provisional = ((ObjectRef.Provisional) ref).object();
        String id = idOf(ref, assigned);
        if (id != null) {
            Node node = working.get(id);
            if (node == null) {
                throw new IllegalStateException("Object " + id + " was removed");
            }
            return node;
        }
        Node node = new Node("id-" + Long.toHexString(idSequence.incrementAndGet() + 0x1000),
                provisional.kind(), provisional.type());
        working.put(node.id, node);
        assigned.put(provisional.handle(), node.id);
        return node;
    }

    private String idOf(ObjectRef ref, Map<Long, String> assigned) {
        if (ref instanceof ObjectRef.Committed committed) {
            return committed.id();
        }
        long handle = ((ObjectRef.Provisional) ref).object().handle();
        String id = assigned.get(handle);
        return id != null ? id : committedIds.get(handle);
    }

    private void removeTree(String rootId, Map<String, Node> working) {
        Set<String> doomed = new HashSet<>();
        doomed.add(rootId);
        boolean grew = true;
        while (grew) {
            grew = false;
            for (Node node : working.values()) {
                if (doomed.contains(node.id)) {
                    continue;
                }
                boolean contained = node.containerId != null && doomed.contains(node.containerId);
                boolean danglingConnection = node.kind == ObjectKind.CONNECTION
                        && (doomed.contains(node.sourceId) || doomed.contains(node.targetId));
                if (contained || danglingConnection) {
                    doomed.add(node.id);
                    grew = true;
                }
            }
        }
        doomed.forEach(working::remove);
    }

    private static ModelObject snapshot(Node node, Map<String, Node> snapshot) {
        String viewId = null;
        if (node.kind == ObjectKind.DIAGRAM_OBJECT || node.kind == ObjectKind.CONNECTION) {
            String cursor = node.containerId;
            int guard = 0;
            while (cursor != null && guard++ < 256) {
                Node container = snapshot.get(cursor);
                if (container == null) {
                    break;
                }
                if (container.kind == ObjectKind.VIEW) {
                    viewId = container.id;
                    break;
                }
                cursor = container.containerId;
            }
        }
        return new ModelObject(node.id, node.kind, node.type, node.name, node.containerId, viewId,
                node.conceptId, node.sourceId, node.targetId, node.properties, node.attributes);
    }

    private static final class Node {
        private final String id;
        private final ObjectKind kind;
        private final String type;
        private String name;
        private String containerId;
        private String conceptId;
        private String sourceId;
        private String targetId;
        private Map<String, String> properties = new LinkedHashMap<>();
        private Map<String, Object> attributes = new HashMap<>();

        private Node(String id, ObjectKind kind, String type) {
            this.id = id;
            this.kind = kind;
            this.type = type;
        }

        private Node copy() {
            Node copy = new Node(id, kind, type);
            copy.name = name;
            copy.containerId = containerId;
            copy.conceptId = conceptId;
            copy.sourceId = sourceId;
            copy.targetId = targetId;
            copy.properties = new LinkedHashMap<>(properties);
            copy.attributes = new HashMap<>(attributes);
            return copy;
        }
    }
}
