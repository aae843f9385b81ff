package com.nayem.tessera.job;

import com.nayem.tessera.error.EngineError;
import com.nayem.tessera.error.ErrorCode;
import com.nayem.tessera.execute.ExecutionReport;
import com.nayem.tessera.execute.OperationResult;
import com.nayem.tessera.model.ObjectRef;
import com.nayem.tessera.operation.Batch;
import com.nayem.tessera.operation.OperationKind;
import com.nayem.tessera.operation.OperationStatus;
import com.nayem.tessera.tempid.MappingKind;
import com.nayem.tessera.tempid.TempIdTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.nayem.tessera.support.Ops.createElement;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private Batch batch;
    private Job job;

    @BeforeEach
    void setUp() {
        batch = Batch.of(List.of(
                createElement("a", "node", "A"),
                createElement("b", "node", "B"),
                createElement("c", "node", "C")));
        job = new Job("op_1_abc", batch, T0, null);
    }

    @Test
    void newJobIsQueuedWithPendingDigest() {
        assertEquals(JobStatus.QUEUED, job.status());
        assertThat(job.digest().integrityFlags().pending()).isTrue();
        assertThat(job.digest().totals().requested()).isEqualTo(3);
        assertThat(job.view(0, 10, false).timeline()).extracting(TimelineEvent::event)
                .containsExactly(TimelineEvent.QUEUED);
    }

    @Test
    void transitionsOnlyMoveForward() {
        assertTrue(job.start(T0.plusMillis(5)));
        assertFalse(job.start(T0.plusMillis(6)));
        assertTrue(job.finish(T0.plusMillis(50), report(null), null));
        assertFalse(job.fail(T0.plusMillis(60), EngineError.of(ErrorCode.INTERNAL_ERROR, "late")));

        assertEquals(JobStatus.COMPLETE, job.status());
        assertThat(job.durationMs()).isEqualTo(45L);
        assertThat(JobStatus.COMPLETE.canTransitionTo(JobStatus.PROCESSING)).isFalse();
        assertThat(JobStatus.QUEUED.canTransitionTo(JobStatus.ERROR)).isTrue();
    }

    @Test
    void completedJobReportsMappingsDigestAndTimeline() {
        job.start(T0);
        job.chunkCommitted(T0.plusMillis(10), 0, 2, 2);
        job.chunkCommitted(T0.plusMillis(20), 1, 2, 1);
        job.finish(T0.plusMillis(30), report(null), null);

        JobView view = job.view(0, 10, false);

        assertThat(view.tempIdMap()).containsExactly(Map.entry("a", "id-a"), Map.entry("b", "id-b"),
                Map.entry("c", "id-c"));
        assertThat(view.tempIdMappings()).extracting(TempIdMapping::opIndex).containsExactly(0, 1, 2);
        assertThat(view.digest().totals().executed()).isEqualTo(3);
        assertThat(view.digest().integrityFlags().pending()).isFalse();
        assertThat(view.digest().integrityFlags().resultCountMatchesRequested()).isTrue();
        assertThat(view.digest().executedByType()).containsEntry("createElement", 3);
        assertThat(view.timeline()).extracting(TimelineEvent::event).containsExactly(TimelineEvent.QUEUED,
                TimelineEvent.PROCESSING, TimelineEvent.CHUNK_COMMITTED, TimelineEvent.CHUNK_COMMITTED,
                TimelineEvent.COMPLETE);
        assertThat(view.timeline().get(3).details()).containsEntry("chunk", 2).containsEntry("chunks", 2);
        assertThat(view.retryHints()).isNull();
    }

    @Test
    void resultsArePaged() {
        job.start(T0);
        job.finish(T0.plusMillis(1), report(null), null);

        JobView first = job.view(0, 2, false);
        JobView second = job.view(first.nextCursor(), 2, false);
        JobView summary = job.view(0, 2, true);

        assertThat(first.results()).hasSize(2);
        assertThat(first.hasMore()).isTrue();
        assertThat(first.nextCursor()).isEqualTo(2);
        assertThat(second.results()).extracting(OperationResult::opIndex).containsExactly(2);
        assertThat(second.hasMore()).isFalse();
        assertThat(second.nextCursor()).isNull();
        assertThat(summary.results()).isNull();
        assertThat(summary.totalResults()).isEqualTo(3);
    }

    @Test
    void rollbackEndsInErrorWithRetryHints() {
        EngineError rollback = EngineError.at(ErrorCode.CHUNK_ROLLBACK, 1, null, "rolled back");
        job.start(T0);

        job.finish(T0.plusMillis(1), report(rollback), null);

        JobView view = job.view(0, 10, false);
        assertEquals(JobStatus.ERROR, view.status());
        assertThat(view.error()).isEqualTo("rolled back");
        assertThat(view.errorDetails().opIndex()).isEqualTo(1);
        assertThat(view.retryHints()).extracting(RetryHint::strategy)
                .containsExactly(RetryHint.RESUBMIT_FROM_INDEX, RetryHint.PER_OPERATION);
        assertThat(view.timeline().get(view.timeline().size() - 1).details())
                .containsEntry("code", "ChunkRollback");
    }

    @Test
    void stoppedRunIsReportedWithTheTimeoutError() {
        EngineError timeout = EngineError.of(ErrorCode.TIMEOUT, "too slow");
        job.start(T0);
        ExecutionReport stopped = new ExecutionReport(List.of(result(0, OperationStatus.CREATED)), null, 2, 1,
                null, true);

        job.finish(T0.plusSeconds(60), stopped, timeout);

        assertEquals(JobStatus.ERROR, job.status());
        assertThat(job.error().code()).isEqualTo(ErrorCode.TIMEOUT);
        assertThat(job.digest().integrityFlags().hadTimeout()).isTrue();
        assertThat(job.digest().integrityFlags().resultCountMatchesRequested()).isFalse();
    }

    @Test
    void summaryCountsExecutedAndSkipped() {
        job.start(T0);
        OperationResult skipped = new OperationResult(2, OperationKind.CREATE_ELEMENT, OperationStatus.SKIPPED,
                null, "c", MappingKind.CONCEPT, "DuplicateConflict", List.of(), Map.of(), null);
        job.finish(T0.plusMillis(3), new ExecutionReport(List.of(result(0, OperationStatus.CREATED),
                result(1, OperationStatus.REUSED), skipped), null, 1, 1, null, false), null);

        JobSummary summary = job.summary();

        assertThat(summary.executed()).isEqualTo(2);
        assertThat(summary.skipped()).isEqualTo(1);
        assertThat(job.digest().skipsByReason()).containsEntry("DuplicateConflict", 1);
        assertThat(job.digest().integrityFlags().hasSkips()).isTrue();
    }

    private ExecutionReport report(EngineError error) {
        TempIdTable tempIds = new TempIdTable();
        String[] names = { "a", "b", "c" };
        for (int i = 0; i < names.length; i++) {
            tempIds.register(names[i], MappingKind.CONCEPT, i, OperationKind.CREATE_ELEMENT);
            if (error == null) {
                tempIds.bind(names[i], ObjectRef.committed("id-" + names[i]));
                tempIds.resolve(names[i], "id-" + names[i]);
            }
        }
        List<OperationResult> results = error == null
                ? List.of(result(0, OperationStatus.CREATED), result(1, OperationStatus.CREATED),
                        result(2, OperationStatus.CREATED))
                : List.of(result(0, OperationStatus.CREATED),
                        OperationResult.unexecuted(1, OperationKind.CREATE_ELEMENT, "b", MappingKind.CONCEPT, error),
                        OperationResult.unexecuted(2, OperationKind.CREATE_ELEMENT, "c", MappingKind.CONCEPT, null));
        return new ExecutionReport(results, tempIds, 2, error == null ? 2 : 1, error, false);
    }

    private static OperationResult result(int index, OperationStatus status) {
        String tempId = String.valueOf((char) ('a' + index));
        return new OperationResult(index, OperationKind.CREATE_ELEMENT, status, "id-" + tempId, tempId,
                MappingKind.CONCEPT, null, List.of(), Map.of(), null);
    }
}
