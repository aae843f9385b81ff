package com.nayem.tessera.tempid;

import com.nayem.tessera.model.ObjectRef;
import com.nayem.tessera.operation.OperationKind;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Job-scoped mapping from client tempIds to the objects they stand for.
 * <p>
 * Not thread-safe; owned by the single pipeline thread running the job.
 * </p>
 */
public class TempIdTable {

    private final Map<String, TempIdEntry> entries = new LinkedHashMap<>();

    /**
     * Registers an unresolved tempId.
     *
     * @return false if the tempId is already registered
     */
    public boolean register(String tempId, MappingKind kind, int opIndex, OperationKind definedBy) {
        if (entries.containsKey(tempId)) {
            return false;
        }
        entries.put(tempId, new TempIdEntry(tempId, kind, opIndex, definedBy));
        return true;
    }

    public Optional<TempIdEntry> lookup(String tempId) {
        return Optional.ofNullable(tempId == null ? null : entries.get(tempId));
    }

    public boolean contains(String tempId) {
        return tempId != null && entries.containsKey(tempId);
    }

    public void bind(String tempId, ObjectRef ref) {
        require(tempId).bind(ref);
    }

    public void markSkipped(String tempId) {
        require(tempId).markSkipped();
    }

    public void resolve(String tempId, String resolvedId) {
        require(tempId).resolve(resolvedId);
    }

    public Collection<TempIdEntry> entries() {
        return Collections.unmodifiableCollection(entries.values());
    }

    /**
     * Resolved tempIds in definition order.
     */
    public Map<String, String> resolvedIds() {
        Map<String, String> resolved = new LinkedHashMap<>();
        entries.values().stream()
                .filter(TempIdEntry::isResolved)
                .forEach(entry -> resolved.put(entry.tempId(), entry.resolvedId()));
        return resolved;
    }

    public int size() {
        return entries.size();
    }

    private TempIdEntry require(String tempId) {
        TempIdEntry entry = entries.get(tempId);
        if (entry == null) {
            throw new IllegalStateException("tempId '" + tempId + "' was never registered");
        }
        return entry;
    }
}
