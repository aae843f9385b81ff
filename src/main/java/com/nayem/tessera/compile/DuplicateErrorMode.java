package com.nayem.tessera.compile;

/**
 * What a {@code DuplicateConflict} under the {@code error} strategy does to the
 * rest of the batch.
 */
public enum DuplicateErrorMode {

    /**
     * Fail the job before anything is submitted.
     */
    ABORT_BATCH,

    /**
     * Mark the operation {@code skipped} and carry on.
     */
    SKIP_OPERATION
}
