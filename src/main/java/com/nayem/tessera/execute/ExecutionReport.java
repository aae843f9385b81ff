package com.nayem.tessera.execute;

import com.nayem.tessera.error.EngineError;
import com.nayem.tessera.tempid.TempIdTable;

import java.util.List;

/**
 * Everything a pipeline run produced.
 *
 * @param results         one result per operation in batch order; empty when
 *                        the batch failed before execution
 * @param tempIds         job tempId table, null when validation failed
 * @param chunksPlanned   number of chunks in the plan
 * @param chunksCommitted number of chunks that committed and verified
 * @param error           error that ended the run early, null on success
 * @param stopped         whether the run stopped at a chunk boundary on request
 */
public record ExecutionReport(
        List<OperationResult> results,
        TempIdTable tempIds,
        int chunksPlanned,
        int chunksCommitted,
        EngineError error,
        boolean stopped) {

    public ExecutionReport {
        results = List.copyOf(results);
    }

    /**
     * Run that ended before any chunk was submitted.
     */
    public static ExecutionReport rejected(EngineError error, TempIdTable tempIds) {
        return new ExecutionReport(List.of(), tempIds, 0, 0, error, false);
    }

    public boolean successful() {
        return error == null && !stopped;
    }
}
