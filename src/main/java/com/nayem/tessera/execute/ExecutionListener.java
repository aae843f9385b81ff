package com.nayem.tessera.execute;

import com.nayem.tessera.plan.Chunk;

/**
 * Callback for chunk-level progress. Invoked on the pipeline thread.
 */
public interface ExecutionListener {

    ExecutionListener NOOP = new ExecutionListener() {
    };

    default void chunkCommitted(Chunk chunk, int chunkCount) {
    }

    default void chunkRolledBack(Chunk chunk, int chunkCount, String reason) {
    }
}
