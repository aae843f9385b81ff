package com.nayem.tessera.error;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of failure kinds reported to clients.
 * <p>
 * The wire name is what appears in the {@code code} field of an error payload.
 * </p>
 */
public enum ErrorCode {

    /**
     * Malformed or out-of-range fields. Raised before any mutation.
     */
    VALIDATION_ERROR("ValidationError", true),

    /**
     * A reference names a tempId that is not defined by an earlier operation.
     */
    UNRESOLVED_TEMP_ID("UnresolvedTempId", true),

    /**
     * A create-like operation matched an existing entity under the {@code error}
     * duplicate strategy.
     */
    DUPLICATE_CONFLICT("DuplicateConflict", false),

    /**
     * The {@code reuse} strategy found more than one candidate.
     */
    AMBIGUOUS_MATCH("AmbiguousMatch", false),

    /**
     * A referenced object no longer exists when the operation is compiled.
     */
    REFERENCE_NOT_FOUND("ReferenceNotFound", true),

    /**
     * The substrate discarded a chunk. Earlier chunks stay committed.
     */
    CHUNK_ROLLBACK("ChunkRollback", false),

    /**
     * Visual endpoints do not match the relationship's direction.
     */
    DIRECTION_MISMATCH("DirectionMismatch", false),

    /**
     * Zero or several visual candidates were found for a connection endpoint.
     */
    AMBIGUOUS_VISUAL_RESOLUTION("AmbiguousVisualResolution", false),

    /**
     * The operation depends on a tempId owned by a skipped operation.
     */
    DEPENDENCY_SKIPPED("DependencySkipped", false),

    /**
     * The connection already exists and the request asked to skip it.
     */
    ALREADY_CONNECTED("AlreadyConnected", false),

    /**
     * Same idempotency key, different payload.
     */
    IDEMPOTENCY_CONFLICT("IdempotencyConflict", true),

    /**
     * The job exceeded the hard processing timeout.
     */
    TIMEOUT("Timeout", false),

    QUEUE_FULL("QueueFull", true),

    ENGINE_STOPPED("EngineStopped", true),

    JOB_NOT_FOUND("JobNotFound", true),

    INTERNAL_ERROR("InternalError", false);

    private final String wireName;
    private final boolean preExecution;

    ErrorCode(String wireName, boolean preExecution) {
        this.wireName = wireName;
        this.preExecution = preExecution;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Whether errors of this kind are always reported before anything is
     * mutated.
     */
    public boolean preExecution() {
        return preExecution;
    }
}
