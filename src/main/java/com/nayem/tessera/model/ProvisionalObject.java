package com.nayem.tessera.model;

/**
 * A detached object produced by {@link ModelSubstrate#instantiateConcept}.
 * <p>
 * It has a construction-time id only. The substrate assigns the final identity
 * when the unit that attaches the object commits; callers must read that
 * identity back through {@link ModelSubstrate#readCommittedState}.
 * </p>
 * Equality is identity.
 */
public final class ProvisionalObject {

    private final long handle;
    private final ObjectKind kind;
    private final String type;
    private final String constructionId;

    public ProvisionalObject(long handle, ObjectKind kind, String type, String constructionId) {
        this.handle = handle;
        this.kind = kind;
        this.type = type;
        this.constructionId = constructionId;
    }

    public long handle() {
        return handle;
    }

    public ObjectKind kind() {
        return kind;
    }

    public String type() {
        return type;
    }

    /**
     * Id the object carried when it was constructed. Not the committed id.
     */
    public String constructionId() {
        return constructionId;
    }

    @Override
    public String toString() {
        return "Provisional[" + kind + " " + type + " #" + handle + "]";
    }
}
