package com.nayem.tessera.model;

import java.util.Collection;
import java.util.Map;

/**
 * The transactional command substrate that owns the live model.
 * <p>
 * Two properties shape everything built on top of it: a commit unit is only
 * atomic up to an opaque primitive ceiling, and the final identity of a new
 * object is assigned at commit time rather than at construction.
 * </p>
 * <p>
 * Not safe for concurrent structural mutation; callers serialize commits.
 * </p>
 */
public interface ModelSubstrate extends ModelReader {

    /**
     * Constructs a detached object. Nothing in the model changes until a
     * primitive attaching the object is committed.
     */
    ProvisionalObject instantiateConcept(ObjectKind kind, String type);

    /**
     * Applies the unit atomically and synchronously.
     */
    CommitOutcome commit(CommitUnit unit);

    /**
     * Committed snapshots of provisional objects, keyed by the provisional
     * object. Objects that were never committed, or were discarded, are absent
     * from the result.
     */
    Map<ProvisionalObject, ModelObject> readCommittedState(Collection<ProvisionalObject> objects);
}
