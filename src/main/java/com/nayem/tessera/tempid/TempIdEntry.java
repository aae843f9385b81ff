package com.nayem.tessera.tempid;

import com.nayem.tessera.model.ObjectRef;
import com.nayem.tessera.operation.OperationKind;

/**
 * State of one tempId through validation, compilation and commit.
 * <p>
 * Validation registers it, compilation binds it to the object that will carry
 * it, and the result collector records the committed id.
 * </p>
 */
public final class TempIdEntry {

    private final String tempId;
    private final MappingKind kind;
    private final int definedAt;
    private final OperationKind definedBy;
    private ObjectRef ref;
    private String resolvedId;
    private boolean skipped;

    TempIdEntry(String tempId, MappingKind kind, int definedAt, OperationKind definedBy) {
        this.tempId = tempId;
        this.kind = kind;
        this.definedAt = definedAt;
        this.definedBy = definedBy;
    }

    public String tempId() {
        return tempId;
    }

    public MappingKind kind() {
        return kind;
    }

    /**
     * Index of the operation that defines the tempId.
     */
    public int definedAt() {
        return definedAt;
    }

    public OperationKind definedBy() {
        return definedBy;
    }

    /**
     * Object the tempId is bound to after compilation, or null.
     */
    public ObjectRef ref() {
        return ref;
    }

    /**
     * Committed id, or null while unresolved.
     */
    public String resolvedId() {
        return resolvedId;
    }

    public boolean isResolved() {
        return resolvedId != null;
    }

    /**
     * Whether the defining operation was skipped, leaving nothing to bind to.
     */
    public boolean isSkipped() {
        return skipped;
    }

    void bind(ObjectRef ref) {
        this.ref = ref;
    }

    void resolve(String id) {
        this.resolvedId = id;
    }

    void markSkipped() {
        this.skipped = true;
    }
}
