package com.nayem.tessera.job;

import com.nayem.tessera.execute.OperationResult;
import com.nayem.tessera.operation.Batch;
import com.nayem.tessera.operation.Operation;
import com.nayem.tessera.operation.OperationStatus;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-job summary: what was asked for, what took effect, what was skipped.
 * <p>
 * Batches are only atomic per chunk, so the integrity flags are how a caller
 * tells "nothing happened" apart from "part of it happened".
 * </p>
 *
 * @param totals          overall counts
 * @param requestedByType operations per kind as submitted
 * @param executedByType  operations per kind that took effect
 * @param skipsByReason   skipped operations per skip reason
 * @param integrityFlags  flags summarizing the outcome
 */
public record Digest(
        Totals totals,
        Map<String, Integer> requestedByType,
        Map<String, Integer> executedByType,
        Map<String, Integer> skipsByReason,
        IntegrityFlags integrityFlags) {

    public record Totals(int requested, int results, int executed, int skipped, int unexecuted) {
    }

    /**
     * @param hasErrors                   the job ended in error
     * @param hasSkips                    at least one operation was skipped
     * @param resultCountMatchesRequested one result per requested operation
     * @param hadTimeout                  the job hit its hard timeout
     * @param pending                     the job has not reached a terminal state
     */
    public record IntegrityFlags(boolean hasErrors, boolean hasSkips, boolean resultCountMatchesRequested,
            boolean hadTimeout, boolean pending) {
    }

    /**
     * Digest of a job that has not produced results yet.
     */
    public static Digest pending(Batch batch) {
        return compute(batch, List.of(), false, false, true);
    }

    public static Digest compute(Batch batch, List<OperationResult> results, boolean hasErrors, boolean hadTimeout,
            boolean pending) {
        Map<String, Integer> requestedByType = new TreeMap<>();
        List<Operation> changes = batch.changes() != null ? batch.changes() : List.of();
        for (Operation operation : changes) {
            if (operation != null) {
                requestedByType.merge(operation.kind().wireName(), 1, Integer::sum);
            }
        }

        Map<String, Integer> executedByType = new TreeMap<>();
        Map<String, Integer> skipsByReason = new TreeMap<>();
        int executed = 0;
        int skipped = 0;
        int unexecuted = 0;
        for (OperationResult result : results) {
            if (result.status() == OperationStatus.SKIPPED) {
                skipped++;
                skipsByReason.merge(result.skipReason() != null ? result.skipReason() : "unknown", 1, Integer::sum);
            } else if (result.status() == OperationStatus.UNEXECUTED) {
                unexecuted++;
            } else {
                executed++;
                executedByType.merge(result.op().wireName(), 1, Integer::sum);
            }
        }

        Totals totals = new Totals(changes.size(), results.size(), executed, skipped, unexecuted);
        IntegrityFlags flags = new IntegrityFlags(hasErrors, skipped > 0, results.size() == changes.size(),
                hadTimeout, pending);
        return new Digest(totals, Collections.unmodifiableMap(requestedByType),
                Collections.unmodifiableMap(executedByType), Collections.unmodifiableMap(skipsByReason), flags);
    }
}
