package com.nayem.tessera.job;

import com.nayem.tessera.error.EngineError;
import com.nayem.tessera.error.ErrorCode;
import com.nayem.tessera.execute.ExecutionReport;
import com.nayem.tessera.execute.OperationResult;
import com.nayem.tessera.idempotency.IdempotencyMeta;
import com.nayem.tessera.operation.Batch;
import com.nayem.tessera.tempid.TempIdEntry;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A submitted batch and everything known about its execution.
 * <p>
 * Written by the pipeline thread, read by pollers; every accessor and
 * transition is synchronized. Once terminal the job no longer changes.
 * </p>
 */
public class Job {

    private final String id;
    private final Batch batch;
    private final Instant submittedAt;
    private final String idempotencyKey;

    private JobStatus status = JobStatus.QUEUED;
    private Instant startedAt;
    private Instant completedAt;
    private List<OperationResult> results = List.of();
    private List<TempIdMapping> tempIdMappings = List.of();
    private Digest digest;
    private EngineError error;
    private List<RetryHint> retryHints = List.of();
    private IdempotencyMeta idempotency;
    private final List<TimelineEvent> timeline = new ArrayList<>();

    public Job(String id, Batch batch, Instant submittedAt, String idempotencyKey) {
        this.id = id;
        this.batch = batch;
        this.submittedAt = submittedAt;
        this.idempotencyKey = idempotencyKey;
        this.digest = Digest.pending(batch);
        this.timeline.add(TimelineEvent.of(TimelineEvent.QUEUED, submittedAt));
    }

    public String id() {
        return id;
    }

    public Batch batch() {
        return batch;
    }

    public Instant submittedAt() {
        return submittedAt;
    }

    public String idempotencyKey() {
        return idempotencyKey;
    }

    public synchronized JobStatus status() {
        return status;
    }

    public synchronized EngineError error() {
        return error;
    }

    public synchronized Digest digest() {
        return digest;
    }

    public synchronized List<OperationResult> results() {
        return results;
    }

    public synchronized Instant completedAt() {
        return completedAt;
    }

    public synchronized boolean isTerminal() {
        return status.isTerminal();
    }

    public synchronized void idempotency(IdempotencyMeta meta) {
        this.idempotency = meta;
    }

    /**
     * {@code queued -> processing}.
     *
     * @return false if the job is no longer queued
     */
    public synchronized boolean start(Instant at) {
        if (!status.canTransitionTo(JobStatus.PROCESSING)) {
            return false;
        }
        status = JobStatus.PROCESSING;
        startedAt = at;
        timeline.add(TimelineEvent.of(TimelineEvent.PROCESSING, at));
        return true;
    }

    public synchronized void chunkCommitted(Instant at, int chunkIndex, int chunkCount, int operations) {
        if (status != JobStatus.PROCESSING) {
            return;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("chunk", chunkIndex + 1);
        details.put("chunks", chunkCount);
        details.put("operations", operations);
        timeline.add(new TimelineEvent(TimelineEvent.CHUNK_COMMITTED, at, details));
    }

    /**
     * Records the outcome of a pipeline run: {@code complete} when it ran to the
     * end, {@code error} otherwise.
     *
     * @param timeoutError error to report when the run stopped on request
     * @return false if the job was already terminal
     */
    public synchronized boolean finish(Instant at, ExecutionReport report, EngineError timeoutError) {
        if (status.isTerminal()) {
            return false;
        }
        EngineError failure = report.error() != null ? report.error() : report.stopped() ? timeoutError : null;
        results = report.results();
        if (report.tempIds() != null) {
            tempIdMappings = report.tempIds().entries().stream()
                    .filter(TempIdEntry::isResolved)
                    .map(entry -> new TempIdMapping(entry.tempId(), entry.resolvedId(), entry.kind(),
                            entry.definedAt()))
                    .toList();
        }
        if (failure == null) {
            terminate(JobStatus.COMPLETE, at, null);
        } else {
            terminate(JobStatus.ERROR, at, failure);
        }
        return true;
    }

    /**
     * Ends the job without results, e.g. on timeout or shutdown.
     *
     * @return false if the job was already terminal
     */
    public synchronized boolean fail(Instant at, EngineError failure) {
        if (status.isTerminal()) {
            return false;
        }
        terminate(JobStatus.ERROR, at, failure);
        return true;
    }

    private void terminate(JobStatus terminal, Instant at, EngineError failure) {
        status = terminal;
        completedAt = at;
        error = failure;
        retryHints = RetryHint.forError(failure);
        digest = Digest.compute(batch, results, failure != null,
                failure != null && failure.code() == ErrorCode.TIMEOUT, false);
        Map<String, Object> details = new LinkedHashMap<>();
        if (failure != null) {
            details.put("code", failure.code().wireName());
        }
        timeline.add(new TimelineEvent(terminal == JobStatus.COMPLETE ? TimelineEvent.COMPLETE
                : TimelineEvent.FAILED, at, details));
    }

    public synchronized Long durationMs() {
        if (completedAt == null) {
            return null;
        }
        Instant from = startedAt != null ? startedAt : submittedAt;
        return Duration.between(from, completedAt).toMillis();
    }

    /**
     * Snapshot with results {@code [cursor, cursor + pageSize)}.
     */
    public synchronized JobView view(int cursor, int pageSize, boolean summaryOnly) {
        int total = results.size();
        int from = Math.min(cursor, total);
        int to = Math.min(from + pageSize, total);
        boolean hasMore = !summaryOnly && to < total;
        Map<String, String> tempIdMap = new LinkedHashMap<>();
        tempIdMappings.forEach(mapping -> tempIdMap.put(mapping.tempId(), mapping.resolvedId()));
        return new JobView(
                id,
                status,
                false,
                digest,
                tempIdMap,
                tempIdMappings,
                summaryOnly ? null : List.copyOf(results.subList(from, to)),
                from,
                hasMore ? to : null,
                hasMore,
                total,
                durationMs(),
                submittedAt,
                startedAt,
                completedAt,
                List.copyOf(timeline),
                error != null ? error.message() : null,
                error,
                retryHints.isEmpty() ? null : retryHints,
                idempotency);
    }

    public synchronized JobSummary summary() {
        return new JobSummary(id, status, digest.totals().requested(), digest.totals().executed(),
                digest.totals().skipped(), submittedAt, startedAt, completedAt, durationMs());
    }
}
