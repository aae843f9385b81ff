package com.nayem.tessera.job;

import com.nayem.tessera.execute.ExecutionReport;

import java.util.function.BooleanSupplier;

/**
 * Runs one job's batch from validation to the last chunk.
 */
@FunctionalInterface
public interface JobRunner {

    /**
     * @param job  the job, already in {@code processing}
     * @param stop polled at chunk boundaries; true means stop before the next
     *             chunk
     */
    ExecutionReport run(Job job, BooleanSupplier stop);
}
