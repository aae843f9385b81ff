package com.nayem.tessera.compile;

/**
 * Handling of per-operation failures such as {@code DirectionMismatch},
 * {@code AmbiguousVisualResolution} and {@code AmbiguousMatch}.
 */
public enum OperationFailurePolicy {

    /**
     * Skip the failing operation, keep the rest of the batch.
     */
    CONTINUE,

    /**
     * Fail the job before anything is submitted.
     */
    ABORT_BATCH
}
