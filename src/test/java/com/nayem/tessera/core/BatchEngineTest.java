package com.nayem.tessera.core;

import com.nayem.tessera.compile.DuplicateErrorMode;
import com.nayem.tessera.error.ErrorCode;
import com.nayem.tessera.error.Result;
import com.nayem.tessera.execute.OperationResult;
import com.nayem.tessera.job.JobFilter;
import com.nayem.tessera.job.JobStatus;
import com.nayem.tessera.job.JobView;
import com.nayem.tessera.model.CommitOutcome;
import com.nayem.tessera.model.CommitUnit;
import com.nayem.tessera.model.InMemoryModelSubstrate;
import com.nayem.tessera.operation.Batch;
import com.nayem.tessera.operation.OperationStatus;
import com.nayem.tessera.support.ModelFixture;
import com.nayem.tessera.support.MutableClock;
import com.nayem.tessera.support.Poll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.nayem.tessera.support.Ops.createElement;
import static com.nayem.tessera.support.Ops.createRelationship;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchEngineTest {

    private BatchEngine engine;

    @AfterEach
    void tearDown() {
        if (engine != null && engine.isAccepting()) {
            engine.shutdown(Duration.ofSeconds(2));
        }
    }

    private BatchEngine start(BatchEngine.Builder builder) {
        engine = builder.build().start();
        return engine;
    }

    private JobView awaitTerminal(String jobId) throws InterruptedException {
        Poll.until(() -> engine.pollStatus(jobId, 0, 1, true).value().status().isTerminal(), Duration.ofSeconds(10));
        return engine.pollStatus(jobId, 0, 100, false).value();
    }

    private static Batch sample() {
        return Batch.of(List.of(
                createElement("customer", "business-actor", "Customer"),
                createElement("buyer", "business-role", "Buyer"),
                createRelationship("plays", "assignment-relationship", "customer", "buyer")));
    }

    @Test
    void runsBatchInChunksAndReportsCommittedIds() throws Exception {
        InMemoryModelSubstrate substrate = new InMemoryModelSubstrate();
        start(BatchEngine.builder().substrate(substrate).maxSubCommandsPerChunk(5));
        int commitsBefore = substrate.commitCount();

        SubmitReceipt receipt = engine.submit(sample()).value();
        assertEquals(JobStatus.QUEUED, receipt.status());
        assertFalse(receipt.replayed());

        JobView view = awaitTerminal(receipt.operationId());

        assertEquals(JobStatus.COMPLETE, view.status());
        assertEquals(2, substrate.commitCount() - commitsBefore);
        assertThat(view.results()).extracting(OperationResult::status).containsOnly(OperationStatus.CREATED);
        assertThat(view.tempIdMap()).containsOnlyKeys("customer", "buyer", "plays");
        assertThat(view.tempIdMap().values()).allSatisfy(id -> {
            assertThat(id).doesNotStartWith("tmp-");
            assertThat(substrate.findById(id)).isPresent();
        });
        assertThat(view.timeline()).extracting(event -> event.event())
                .containsSubsequence("queued", "processing", "chunk-committed", "chunk-committed", "complete");
        assertTrue(view.digest().integrityFlags().resultCountMatchesRequested());
    }

    @Test
    void replaysCompletedJobForSameKeyAndPayload() throws Exception {
        start(BatchEngine.builder().substrate(new InMemoryModelSubstrate()));
        Batch batch = sample().withIdempotencyKey("import-2026-03");

        SubmitReceipt first = engine.submit(batch).value();
        awaitTerminal(first.operationId());
        SubmitReceipt second = engine.submit(sample().withIdempotencyKey("import-2026-03")).value();

        assertTrue(second.replayed());
        assertEquals(first.operationId(), second.operationId());
        assertEquals(JobStatus.COMPLETE, second.status());
        assertThat(second.result()).isNotNull();
        assertThat(second.result().results()).hasSize(3);
        assertTrue(second.idempotency().replayed());
        assertEquals(1, engine.listJobs(JobFilter.all()).size());
    }

    @Test
    void rejectsKeyReusedWithDifferentPayload() throws Exception {
        start(BatchEngine.builder().substrate(new InMemoryModelSubstrate()));
        SubmitReceipt first = engine.submit(sample().withIdempotencyKey("import-1")).value();
        awaitTerminal(first.operationId());

        Result<SubmitReceipt> conflict = engine.submit(Batch.of(List.of(
                createElement("x", "business-actor", "Someone Else"))).withIdempotencyKey("import-1"));

        assertFalse(conflict.isOk());
        assertEquals(ErrorCode.IDEMPOTENCY_CONFLICT, conflict.error().code());
    }

    @Test
    void idempotencyKeyIsReusableOnceItsRecordExpires() throws Exception {
        MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        start(BatchEngine.builder().substrate(new InMemoryModelSubstrate()).clock(clock)
                .idempotencyTtl(Duration.ofHours(1)));
        SubmitReceipt first = engine.submit(sample().withIdempotencyKey("nightly")).value();
        awaitTerminal(first.operationId());
        Poll.until(() -> engine.pollStatus(first.operationId(), 0, 1, true).value().idempotency().expiresAt() != null,
                Duration.ofSeconds(5));
        assertEquals(1, engine.stats().idempotencyRecords());

        clock.advance(Duration.ofHours(2));
        engine.purgeExpiredIdempotencyRecords();
        assertEquals(0, engine.stats().idempotencyRecords());

        Result<SubmitReceipt> fresh = engine.submit(Batch.of(List.of(
                createElement("x", "business-actor", "Someone Else"))).withIdempotencyKey("nightly"));
        assertTrue(fresh.isOk());
        assertFalse(fresh.value().replayed());
    }

    @Test
    void rejectsMalformedIdempotencyKeyAtSubmit() {
        start(BatchEngine.builder().substrate(new InMemoryModelSubstrate()));

        Result<SubmitReceipt> result = engine.submit(sample().withIdempotencyKey("has spaces"));

        assertEquals(ErrorCode.VALIDATION_ERROR, result.error().code());
        assertEquals("idempotencyKey", result.error().field());
    }

    @Test
    void duplicateAbortsWholeBatchByDefault() throws Exception {
        InMemoryModelSubstrate substrate = new InMemoryModelSubstrate();
        new ModelFixture(substrate).element("business-actor", "Customer");
        start(BatchEngine.builder().substrate(substrate));
        int sizeBefore = substrate.size();

        JobView view = awaitTerminal(engine.submit(sample()).value().operationId());

        assertEquals(JobStatus.ERROR, view.status());
        assertEquals(ErrorCode.DUPLICATE_CONFLICT, view.errorDetails().code());
        assertEquals(0, view.errorDetails().opIndex());
        assertEquals(sizeBefore, substrate.size());
        assertThat(view.retryHints()).isNotEmpty();
    }

    @Test
    void duplicateIsSkippedInSkipOperationMode() throws Exception {
        InMemoryModelSubstrate substrate = new InMemoryModelSubstrate();
        new ModelFixture(substrate).element("business-actor", "Customer");
        start(BatchEngine.builder().substrate(substrate).duplicateErrorMode(DuplicateErrorMode.SKIP_OPERATION));

        JobView view = awaitTerminal(engine.submit(sample()).value().operationId());

        assertEquals(JobStatus.COMPLETE, view.status());
        assertThat(view.results()).extracting(OperationResult::status)
                .containsExactly(OperationStatus.SKIPPED, OperationStatus.CREATED, OperationStatus.SKIPPED);
        assertThat(view.results()).extracting(OperationResult::skipReason)
                .containsExactly("DuplicateConflict", null, "DependencySkipped");
        assertThat(view.tempIdMap()).containsOnlyKeys("buyer");
        assertTrue(view.digest().integrityFlags().hasSkips());
    }

    @Test
    void validationFailureEndsJobInError() throws Exception {
        start(BatchEngine.builder().substrate(new InMemoryModelSubstrate()));

        JobView view = awaitTerminal(engine.submit(Batch.of(List.of(
                createRelationship("r", "assignment-relationship", "nobody", "nothing")))).value().operationId());

        assertEquals(JobStatus.ERROR, view.status());
        assertThat(view.errorDetails().code()).isIn(ErrorCode.UNRESOLVED_TEMP_ID, ErrorCode.REFERENCE_NOT_FOUND);
        assertThat(view.results()).isEmpty();
    }

    @Test
    void rejectsSubmissionsWhenQueueIsFull() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        InMemoryModelSubstrate blocking = new InMemoryModelSubstrate() {
            @Override
            public CommitOutcome commit(CommitUnit unit) {
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.commit(unit);
            }
        };
        start(BatchEngine.builder().substrate(blocking).maxQueuedJobs(1));

        String running = engine.submit(Batch.of(List.of(createElement("a", "node", "A")))).value().operationId();
        Poll.until(() -> engine.pollStatus(running, 0, 1, true).value().status() == JobStatus.PROCESSING,
                Duration.ofSeconds(5));
        Result<SubmitReceipt> waiting = engine.submit(Batch.of(List.of(createElement("b", "node", "B"))));
        Result<SubmitReceipt> rejected = engine.submit(Batch.of(List.of(createElement("c", "node", "C"))));

        assertTrue(waiting.isOk());
        assertEquals(ErrorCode.QUEUE_FULL, rejected.error().code());
        assertEquals(1, engine.stats().queued());
        assertEquals(1, engine.stats().processing());

        release.countDown();
        awaitTerminal(waiting.value().operationId());
        assertEquals(2, engine.stats().complete());
    }

    @Test
    void pollStatusValidatesPagingAndUnknownIds() throws Exception {
        start(BatchEngine.builder().substrate(new InMemoryModelSubstrate()));
        String jobId = engine.submit(sample()).value().operationId();
        awaitTerminal(jobId);

        assertEquals(ErrorCode.VALIDATION_ERROR, engine.pollStatus(jobId, -1, 10, false).error().code());
        assertEquals(ErrorCode.VALIDATION_ERROR, engine.pollStatus(jobId, 0, 0, false).error().code());
        assertEquals(ErrorCode.JOB_NOT_FOUND, engine.pollStatus("op_missing", 0, 10, false).error().code());

        JobView page = engine.pollStatus(jobId, 1, 1, false).value();
        assertEquals(1, page.results().size());
        assertEquals(1, page.results().get(0).opIndex());
        assertTrue(page.hasMore());
        assertEquals(3, page.totalResults());
    }

    @Test
    void listsJobsNewestFirstAndCountsThem() throws Exception {
        start(BatchEngine.builder().substrate(new InMemoryModelSubstrate()));
        String first = engine.submit(Batch.of(List.of(createElement("a", "node", "A")))).value().operationId();
        awaitTerminal(first);
        Thread.sleep(5);
        String second = engine.submit(Batch.of(List.of(createElement("b", "node", "B")))).value().operationId();
        awaitTerminal(second);

        assertThat(engine.listJobs(JobFilter.all())).extracting(summary -> summary.operationId())
                .containsExactly(second, first);
        assertThat(engine.listJobs(JobFilter.byStatus(JobStatus.ERROR))).isEmpty();
        EngineStats stats = engine.stats();
        assertEquals(2, stats.complete());
        assertEquals(0, stats.queued());
    }

    @Test
    void refusesSubmissionsAfterShutdown() {
        start(BatchEngine.builder().substrate(new InMemoryModelSubstrate()));

        engine.shutdown(Duration.ofSeconds(1));

        assertFalse(engine.isAccepting());
        assertEquals(ErrorCode.ENGINE_STOPPED, engine.submit(sample()).error().code());
    }

    @Test
    void builderRequiresSubstrate() {
        assertThrows(IllegalStateException.class, () -> BatchEngine.builder().build());
        assertThrows(IllegalStateException.class,
                () -> BatchEngine.builder().substrate(new InMemoryModelSubstrate()).maxChanges(1001).build());
    }
}
