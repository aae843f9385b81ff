package com.nayem.tessera.execute;

import com.nayem.tessera.compile.CompiledOperation;
import com.nayem.tessera.error.EngineError;
import com.nayem.tessera.error.ErrorCode;
import com.nayem.tessera.model.CommitOutcome;
import com.nayem.tessera.model.CommitUnit;
import com.nayem.tessera.model.Fields;
import com.nayem.tessera.model.ModelObject;
import com.nayem.tessera.model.ModelSubstrate;
import com.nayem.tessera.model.ObjectKind;
import com.nayem.tessera.model.ObjectRef;
import com.nayem.tessera.model.Primitive;
import com.nayem.tessera.model.ProvisionalObject;
import com.nayem.tessera.plan.Chunk;
import com.nayem.tessera.plan.ChunkPlan;
import com.nayem.tessera.tempid.TempIdTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Submits a chunk plan to the substrate, one chunk at a time.
 * <p>
 * Each chunk is verified against committed state before its results are
 * collected. The first chunk that rolls back, explicitly or silently, ends the
 * run: its operations and every later one are reported unexecuted, while
 * chunks committed before it stay committed.
 * </p>
 */
public class TransactionExecutor {

    private static final Logger log = LoggerFactory.getLogger(TransactionExecutor.class);

    private final ModelSubstrate substrate;
    private final ResultCollector collector;
    private final boolean verifyCommits;

    public TransactionExecutor(ModelSubstrate substrate) {
        this(substrate, new ResultCollector(substrate), true);
    }

    public TransactionExecutor(ModelSubstrate substrate, ResultCollector collector, boolean verifyCommits) {
        this.substrate = substrate;
        this.collector = collector;
        this.verifyCommits = verifyCommits;
    }

    /**
     * Runs the plan in order.
     *
     * @param plan     chunks to commit
     * @param tempIds  job tempId table, updated as chunks commit
     * @param stop     checked before every chunk; when it returns true the run
     *                 ends and the remaining operations are left unexecuted
     * @param listener progress callback
     */
    public ExecutionReport execute(ChunkPlan plan, TempIdTable tempIds, BooleanSupplier stop,
            ExecutionListener listener) {
        List<OperationResult> results = new ArrayList<>();
        int committed = 0;

        for (Chunk chunk : plan.chunks()) {
            if (stop.getAsBoolean()) {
                log.warn("Stopping before chunk {}/{} on request", chunk.index() + 1, plan.size());
                addUnexecuted(results, plan, chunk.index(), null);
                return new ExecutionReport(results, tempIds, plan.size(), committed, null, true);
            }

            Optional<String> failure = commit(chunk);
            if (failure.isPresent()) {
                EngineError error = rollbackError(chunk, plan, failure.get());
                log.warn("Chunk {}/{} rolled back: {}", chunk.index() + 1, plan.size(), failure.get());
                listener.chunkRolledBack(chunk, plan.size(), failure.get());
                addUnexecuted(results, plan, chunk.index(), error);
                return new ExecutionReport(results, tempIds, plan.size(), committed, error, false);
            }

            results.addAll(collector.collect(chunk, tempIds));
            committed++;
            log.debug("Committed chunk {}/{} ({} ops, {} sub-commands)", chunk.index() + 1, plan.size(),
                    chunk.operations().size(), chunk.subCommandCount());
            listener.chunkCommitted(chunk, plan.size());
        }
        return new ExecutionReport(results, tempIds, plan.size(), committed, null, false);
    }

    /**
     * @return the rollback reason, or empty if the chunk committed
     */
    private Optional<String> commit(Chunk chunk) {
        CommitUnit unit = chunk.toCommitUnit();
        if (unit.size() == 0) {
            return Optional.empty();
        }
        CommitOutcome outcome;
        try {
            outcome = substrate.commit(unit);
        } catch (RuntimeException e) {
            log.warn("Substrate rejected '{}'", unit.label(), e);
            return Optional.of("commit failed: " + e.getMessage());
        }
        if (!outcome.committed()) {
            return Optional.of(outcome.reason() != null ? outcome.reason() : "substrate rolled back the unit");
        }
        if (verifyCommits && !verify(unit)) {
            return Optional.of("commit reported success but its changes are not in the model");
        }
        return Optional.empty();
    }

    /**
     * Checks that the unit's effects are visible: created objects exist, removed
     * objects are gone, and the last value written to each name, text field
     * and property is the committed one.
     * <p>
     * Removal cascades to contained objects and to connections attached to a
     * removed diagram object. Objects created in the unit and caught by such a
     * cascade are exempt from the presence and value checks; every other
     * created object must resolve.
     * </p>
     */
    boolean verify(CommitUnit unit) {
        Set<ObjectRef> removed = new LinkedHashSet<>();
        Set<ProvisionalObject> provisionals = new LinkedHashSet<>();
        Set<String> touched = new LinkedHashSet<>();
        Map<ProvisionalObject, Set<ObjectRef>> anchors = new HashMap<>();
        Map<ObjectRef, Map<String, Object>> lastFields = new LinkedHashMap<>();
        Map<ObjectRef, Map<String, String>> lastProperties = new LinkedHashMap<>();

        for (Primitive primitive : unit.primitives()) {
            if (primitive instanceof Primitive.Remove remove) {
                removed.add(remove.target());
                continue;
            }
            ObjectRef subject = primitive.subject();
            if (subject instanceof ObjectRef.Provisional p) {
                provisionals.add(p.object());
                anchorOf(primitive, p.object())
                        .ifPresent(anchor -> anchors.computeIfAbsent(p.object(), k -> new HashSet<>()).add(anchor));
            } else if (subject instanceof ObjectRef.Committed c) {
                touched.add(c.id());
            }
            if (primitive instanceof Primitive.SetField set && isTextField(set.field())) {
                lastFields.computeIfAbsent(subject, k -> new HashMap<>()).put(set.field(), set.value());
            } else if (primitive instanceof Primitive.SetProperty set) {
                lastProperties.computeIfAbsent(subject, k -> new HashMap<>()).put(set.key(), set.value());
            }
        }

        Set<ObjectRef> doomed = cascade(removed, anchors);
        Set<ProvisionalObject> lookup = new LinkedHashSet<>(provisionals);
        removed.forEach(ref -> {
            if (ref instanceof ObjectRef.Provisional p) {
                lookup.add(p.object());
            }
        });
        Map<ProvisionalObject, ModelObject> committedState = substrate.readCommittedState(lookup);

        for (ObjectRef ref : removed) {
            boolean present = ref instanceof ObjectRef.Committed c
                    ? substrate.exists(c.id())
                    : committedState.containsKey(((ObjectRef.Provisional) ref).object());
            if (present) {
                log.debug("Verification failed: {} still present", ref);
                return false;
            }
        }

        for (ProvisionalObject provisional : provisionals) {
            if (!doomed.contains(ObjectRef.provisional(provisional)) && !committedState.containsKey(provisional)) {
                log.debug("Verification failed: {} was not committed", provisional);
                return false;
            }
        }
        // A committed object may sit inside a removed container, which only the model knows.
        boolean removes = !removed.isEmpty();
        for (String id : touched) {
            if (!removes && !substrate.exists(id)) {
                log.debug("Verification failed: {} is missing", id);
                return false;
            }
        }
        for (Map.Entry<ObjectRef, Map<String, Object>> entry : lastFields.entrySet()) {
            if (doomed.contains(entry.getKey())) {
                continue;
            }
            Optional<ModelObject> object = snapshot(entry.getKey(), committedState);
            if (object.isEmpty() && removes && entry.getKey() instanceof ObjectRef.Committed) {
                continue;
            }
            for (Map.Entry<String, Object> field : entry.getValue().entrySet()) {
                Object actual = object.map(o -> Fields.NAME.equals(field.getKey()) ? o.name()
                        : o.attribute(field.getKey())).orElse(null);
                if (!Objects.equals(field.getValue(), actual)) {
                    log.debug("Verification failed: {}.{} is {}, expected {}", entry.getKey(), field.getKey(),
                            actual, field.getValue());
                    return false;
                }
            }
        }
        for (Map.Entry<ObjectRef, Map<String, String>> entry : lastProperties.entrySet()) {
            if (doomed.contains(entry.getKey())) {
                continue;
            }
            Optional<ModelObject> object = snapshot(entry.getKey(), committedState);
            if (object.isEmpty() && removes && entry.getKey() instanceof ObjectRef.Committed) {
                continue;
            }
            Map<String, String> actual = object.map(ModelObject::properties).orElse(Map.of());
            for (Map.Entry<String, String> property : entry.getValue().entrySet()) {
                if (!Objects.equals(property.getValue(), actual.get(property.getKey()))) {
                    log.debug("Verification failed: property {} of {} not applied", property.getKey(),
                            entry.getKey());
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * The object whose removal takes {@code object} with it: its container, or
     * for a connection either visual endpoint.
     */
    private static Optional<ObjectRef> anchorOf(Primitive primitive, ProvisionalObject object) {
        if (primitive instanceof Primitive.AddToView add) {
            return Optional.of(add.container());
        }
        if (primitive instanceof Primitive.AddToFolder add) {
            return Optional.of(add.folder());
        }
        if (object.kind() == ObjectKind.CONNECTION && primitive instanceof Primitive.SetField set
                && (Fields.SOURCE.equals(set.field()) || Fields.TARGET.equals(set.field()))
                && set.value() instanceof ObjectRef endpoint) {
            return Optional.of(endpoint);
        }
        return Optional.empty();
    }

    /**
     * Removed refs plus every object created in the unit that hangs off one of
     * them, directly or transitively.
     */
    private static Set<ObjectRef> cascade(Set<ObjectRef> removed, Map<ProvisionalObject, Set<ObjectRef>> anchors) {
        Set<ObjectRef> doomed = new HashSet<>(removed);
        boolean grew = !removed.isEmpty();
        while (grew) {
            grew = false;
            for (Map.Entry<ProvisionalObject, Set<ObjectRef>> entry : anchors.entrySet()) {
                ObjectRef ref = ObjectRef.provisional(entry.getKey());
                if (!doomed.contains(ref) && entry.getValue().stream().anyMatch(doomed::contains)) {
                    doomed.add(ref);
                    grew = true;
                }
            }
        }
        return doomed;
    }

    private Optional<ModelObject> snapshot(ObjectRef ref, Map<ProvisionalObject, ModelObject> committedState) {
        if (ref instanceof ObjectRef.Committed c) {
            return substrate.findById(c.id());
        }
        return Optional.ofNullable(committedState.get(((ObjectRef.Provisional) ref).object()));
    }

    private static boolean isTextField(String field) {
        return switch (field) {
            case Fields.NAME, Fields.DOCUMENTATION, Fields.CONTENT, Fields.VIEWPOINT, Fields.ACCESS_TYPE,
                    Fields.STRENGTH, Fields.FILL_COLOR, Fields.LINE_COLOR, Fields.FONT_COLOR, Fields.FONT -> true;
            default -> false;
        };
    }

    private static EngineError rollbackError(Chunk chunk, ChunkPlan plan, String reason) {
        return EngineError.at(ErrorCode.CHUNK_ROLLBACK, chunk.firstOpIndex(), null,
                "Chunk " + (chunk.index() + 1) + " of " + plan.size() + " (operations " + chunk.firstOpIndex()
                        + ".." + chunk.lastOpIndex() + ") was rolled back: " + reason)
                .withHint("The chunk carried " + chunk.subCommandCount() + " sub-commands. Operations before "
                        + chunk.firstOpIndex() + " are committed; resubmit from operation " + chunk.firstOpIndex()
                        + ", with a lower chunk ceiling or per-operation granularity");
    }

    private static void addUnexecuted(List<OperationResult> results, ChunkPlan plan, int fromChunk,
            EngineError error) {
        boolean first = true;
        for (Chunk chunk : plan.chunks().subList(fromChunk, plan.size())) {
            for (CompiledOperation operation : chunk.operations()) {
                results.add(OperationResult.unexecuted(operation.opIndex(), operation.source().kind(),
                        operation.plan().tempId(), operation.plan().mappingKind(), first ? error : null));
                first = false;
            }
        }
    }
}
