package com.nayem.tessera.execute;

import com.nayem.tessera.compile.CompiledOperation;
import com.nayem.tessera.compile.ResultPlan;
import com.nayem.tessera.model.ModelObject;
import com.nayem.tessera.model.ModelSubstrate;
import com.nayem.tessera.model.ObjectKind;
import com.nayem.tessera.model.ObjectRef;
import com.nayem.tessera.model.ProvisionalObject;
import com.nayem.tessera.operation.OperationStatus;
import com.nayem.tessera.plan.Chunk;
import com.nayem.tessera.tempid.TempIdTable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds operation results for a chunk that has committed.
 * <p>
 * Ids and display fields come from committed state only. A provisional object
 * keeps its construction-time id until commit, so nothing captured during
 * compilation is reported as an id.
 * </p>
 */
public class ResultCollector {

    private final ModelSubstrate substrate;

    public ResultCollector(ModelSubstrate substrate) {
        this.substrate = substrate;
    }

    /**
     * Results for every operation of the chunk, in order. Records the committed
     * id of each tempId the chunk owns in {@code tempIds}.
     */
    public List<OperationResult> collect(Chunk chunk, TempIdTable tempIds) {
        Map<ProvisionalObject, ModelObject> committed = substrate.readCommittedState(provisionalsOf(chunk));
        List<OperationResult> results = new ArrayList<>(chunk.operations().size());
        for (CompiledOperation operation : chunk.operations()) {
            results.add(collect(operation, committed, tempIds));
        }
        return results;
    }

    private OperationResult collect(CompiledOperation operation, Map<ProvisionalObject, ModelObject> committed,
            TempIdTable tempIds) {
        ResultPlan plan = operation.plan();
        Map<String, String> details = new LinkedHashMap<>(plan.details());
        plan.detailRefs().forEach((key, ref) -> {
            String id = idOf(ref, committed);
            if (id != null) {
                details.put(key, id);
                nameOf(ref, committed).ifPresent(name -> details.put(nameKey(key), name));
            }
        });

        if (plan.status() == OperationStatus.SKIPPED) {
            return new OperationResult(operation.opIndex(), operation.source().kind(), OperationStatus.SKIPPED,
                    null, plan.tempId(), plan.mappingKind(), plan.skipReason(), plan.warnings(), details,
                    plan.error());
        }

        String resolvedId = idOf(plan.subject(), committed);
        if (plan.tempId() != null && resolvedId != null) {
            tempIds.resolve(plan.tempId(), resolvedId);
        }
        return new OperationResult(operation.opIndex(), operation.source().kind(), plan.status(), resolvedId,
                plan.tempId(), plan.mappingKind(), null, plan.warnings(), details, null);
    }

    /**
     * Committed id of {@code ref}. Removed provisional objects have none.
     */
    private static String idOf(ObjectRef ref, Map<ProvisionalObject, ModelObject> committed) {
        if (ref == null) {
            return null;
        }
        if (ref instanceof ObjectRef.Committed c) {
            return c.id();
        }
        ModelObject object = committed.get(((ObjectRef.Provisional) ref).object());
        return object != null ? object.id() : null;
    }

    private Optional<String> nameOf(ObjectRef ref, Map<ProvisionalObject, ModelObject> committed) {
        Optional<ModelObject> object = ref instanceof ObjectRef.Committed c
                ? substrate.findById(c.id())
                : Optional.ofNullable(committed.get(((ObjectRef.Provisional) ref).object()));
        return object
                .filter(o -> o.kind() == ObjectKind.ELEMENT || o.kind() == ObjectKind.RELATIONSHIP
                        || o.kind() == ObjectKind.FOLDER || o.kind() == ObjectKind.VIEW)
                .map(ModelObject::name);
    }

    private static String nameKey(String idKey) {
        return idKey.endsWith("Id") ? idKey.substring(0, idKey.length() - 2) + "Name" : idKey + "Name";
    }

    private static Set<ProvisionalObject> provisionalsOf(Chunk chunk) {
        Set<ProvisionalObject> provisionals = new LinkedHashSet<>();
        for (CompiledOperation operation : chunk.operations()) {
            addIfProvisional(provisionals, operation.plan().subject());
            operation.plan().detailRefs().values().forEach(ref -> addIfProvisional(provisionals, ref));
        }
        return provisionals;
    }

    private static void addIfProvisional(Set<ProvisionalObject> provisionals, ObjectRef ref) {
        if (ref instanceof ObjectRef.Provisional p) {
            provisionals.add(p.object());
        }
    }
}
