package com.nayem.tessera.job;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.nayem.tessera.error.EngineError;
import com.nayem.tessera.execute.OperationResult;
import com.nayem.tessera.idempotency.IdempotencyMeta;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Poll response: a consistent snapshot of one job, with one page of results.
 *
 * @param operationId    job id
 * @param status         job status
 * @param replayed       whether this answer comes from an idempotent replay
 * @param digest         counts and integrity flags
 * @param tempIdMap      resolved tempIds
 * @param tempIdMappings resolved tempIds with their kind and defining operation
 * @param results        requested page of results; null in summary-only mode
 * @param cursor         index of the first result in the page
 * @param nextCursor     cursor for the next page, null when there is none
 * @param hasMore        whether results remain after this page
 * @param totalResults   number of results the job has
 * @param durationMs     processing time of a terminal job
 * @param submittedAt    when the job was accepted
 * @param startedAt      when processing started
 * @param completedAt    when the job reached a terminal state
 * @param timeline       status-change events
 * @param error          error message of a failed job
 * @param errorDetails   structured error of a failed job
 * @param retryHints     suggestions for resubmitting a failed job
 * @param idempotency    idempotency metadata when the request carried a key
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobView(
        String operationId,
        JobStatus status,
        boolean replayed,
        Digest digest,
        Map<String, String> tempIdMap,
        List<TempIdMapping> tempIdMappings,
        List<OperationResult> results,
        int cursor,
        Integer nextCursor,
        boolean hasMore,
        int totalResults,
        Long durationMs,
        Instant submittedAt,
        Instant startedAt,
        Instant completedAt,
        List<TimelineEvent> timeline,
        String error,
        EngineError errorDetails,
        List<RetryHint> retryHints,
        IdempotencyMeta idempotency) {

    /**
     * The same snapshot, answering a replayed request.
     */
    public JobView asReplay(IdempotencyMeta meta) {
        return new JobView(operationId, status, true, digest, tempIdMap, tempIdMappings, results, cursor,
                nextCursor, hasMore, totalResults, durationMs, submittedAt, startedAt, completedAt, timeline, error,
                errorDetails, retryHints, meta);
    }
}
