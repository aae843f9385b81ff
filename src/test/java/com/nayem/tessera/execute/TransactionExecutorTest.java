package com.nayem.tessera.execute;

import com.nayem.tessera.compile.CompiledOperation;
import com.nayem.tessera.compile.OperationCompiler;
import com.nayem.tessera.compile.ResultPlan;
import com.nayem.tessera.error.ErrorCode;
import com.nayem.tessera.model.CommitUnit;
import com.nayem.tessera.model.InMemoryModelSubstrate;
import com.nayem.tessera.model.ModelSubstrate;
import com.nayem.tessera.model.ObjectRef;
import com.nayem.tessera.model.Primitive;
import com.nayem.tessera.operation.Batch;
import com.nayem.tessera.operation.ExecutionGranularity;
import com.nayem.tessera.operation.Operation;
import com.nayem.tessera.operation.OperationStatus;
import com.nayem.tessera.plan.Chunk;
import com.nayem.tessera.plan.ChunkPlan;
import com.nayem.tessera.plan.ChunkPlanner;
import com.nayem.tessera.support.Ops;
import com.nayem.tessera.tempid.TempIdTable;
import com.nayem.tessera.validate.BatchValidator;
import com.nayem.tessera.validate.ValidatedBatch;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static com.nayem.tessera.support.Ops.createElement;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TransactionExecutorTest {

    private record Prepared(ChunkPlan plan, TempIdTable tempIds) {
    }

    private static Prepared prepare(ModelSubstrate substrate, Batch batch, int ceiling) {
        ValidatedBatch validated = new BatchValidator(substrate).validate(batch).value();
        List<CompiledOperation> compiled = new OperationCompiler(substrate).compileAll(validated).value();
        return new Prepared(new ChunkPlanner().plan(compiled, ceiling, ExecutionGranularity.PER_BATCH_CHUNKING),
                validated.tempIds());
    }

    @Test
    void reportsCommittedIdsRatherThanConstructionIds() {
        InMemoryModelSubstrate substrate = new InMemoryModelSubstrate(4);
        Prepared prepared = prepare(substrate, Batch.of(List.of(
                createElement("a", "business-actor", "A"),
                createElement("b", "business-actor", "B"),
                createElement("c", "business-actor", "C"),
                createElement("d", "business-actor", "D"))), 4);
        AtomicInteger committedChunks = new AtomicInteger();

        ExecutionReport report = new TransactionExecutor(substrate).execute(prepared.plan(), prepared.tempIds(),
                () -> false, new ExecutionListener() {
                    @Override
                    public void chunkCommitted(Chunk chunk, int chunkCount) {
                        committedChunks.incrementAndGet();
                    }
                });

        assertThat(report.successful()).isTrue();
        assertThat(report.chunksPlanned()).isEqualTo(2);
        assertThat(report.chunksCommitted()).isEqualTo(2);
        assertThat(committedChunks).hasValue(2);
        assertThat(report.results()).extracting(OperationResult::status).containsOnly(OperationStatus.CREATED);
        assertThat(report.results()).allSatisfy(result -> {
            assertThat(result.resolvedId()).startsWith("id-");
            assertThat(substrate.exists(result.resolvedId())).isTrue();
        });
        assertThat(prepared.tempIds().resolvedIds()).containsOnlyKeys("a", "b", "c", "d");
        assertThat(prepared.tempIds().resolvedIds().values()).noneMatch(id -> id.startsWith("tmp-"));
    }

    @Test
    void silentlyDiscardedChunkIsDetectedAsRollback() {
        InMemoryModelSubstrate substrate = new InMemoryModelSubstrate(4);
        Operation wide = new Operation.CreateElement("w", "node", "Wide", null,
                Map.of("k1", "1", "k2", "2", "k3", "3", "k4", "4"), null, null);
        Prepared prepared = prepare(substrate, Batch.of(List.of(
                createElement("a", "node", "A"),
                createElement("b", "node", "B"),
                wide,
                createElement("c", "node", "C"))), 4);
        int sizeBefore = substrate.size();

        ExecutionReport report = new TransactionExecutor(substrate).execute(prepared.plan(), prepared.tempIds(),
                () -> false, ExecutionListener.NOOP);

        assertThat(report.successful()).isFalse();
        assertThat(report.chunksCommitted()).isEqualTo(1);
        assertThat(report.error().code()).isEqualTo(ErrorCode.CHUNK_ROLLBACK);
        assertThat(report.error().opIndex()).isEqualTo(2);
        assertThat(report.results()).extracting(OperationResult::status).containsExactly(
                OperationStatus.CREATED, OperationStatus.CREATED, OperationStatus.UNEXECUTED,
                OperationStatus.UNEXECUTED);
        assertThat(report.results().get(2).error()).isNotNull();
        assertThat(report.results().get(3).error()).isNull();
        assertThat(report.results().get(2).resolvedId()).isNull();
        assertThat(substrate.size()).isEqualTo(sizeBefore + 2);
        assertThat(prepared.tempIds().resolvedIds()).containsOnlyKeys("a", "b");
    }

    @Test
    void discardedChunkThatRemovesItsOwnCreationIsStillARollback() {
        InMemoryModelSubstrate substrate = new InMemoryModelSubstrate(4);
        Prepared prepared = prepare(substrate, Batch.of(List.of(
                createElement("a", "node", "A"),
                createElement("b", "node", "B"),
                new Operation.DeleteElement("a", null))), 0);
        int sizeBefore = substrate.size();

        ExecutionReport report = new TransactionExecutor(substrate).execute(prepared.plan(), prepared.tempIds(),
                () -> false, ExecutionListener.NOOP);

        assertThat(prepared.plan().size()).isEqualTo(1);
        assertThat(report.successful()).isFalse();
        assertThat(report.error().code()).isEqualTo(ErrorCode.CHUNK_ROLLBACK);
        assertThat(report.error().opIndex()).isZero();
        assertThat(report.results()).extracting(OperationResult::status).containsOnly(OperationStatus.UNEXECUTED);
        assertThat(substrate.size()).isEqualTo(sizeBefore);
    }

    @Test
    void objectsCreatedAndRemovedInTheSameChunkPassVerification() {
        InMemoryModelSubstrate substrate = new InMemoryModelSubstrate();
        Prepared prepared = prepare(substrate, Batch.of(List.of(
                createElement("a", "node", "A"),
                createElement("b", "node", "B"),
                Ops.createView("v", "Main"),
                Ops.addToView("va", "v", "a"),
                Ops.addToView("vb", "v", "b"),
                new Operation.DeleteElement("a", null))), 0);

        ExecutionReport report = new TransactionExecutor(substrate).execute(prepared.plan(), prepared.tempIds(),
                () -> false, ExecutionListener.NOOP);

        assertThat(report.successful()).isTrue();
        assertThat(report.chunksCommitted()).isEqualTo(1);
        assertThat(report.results().get(5).status()).isEqualTo(OperationStatus.DELETED);
        assertThat(prepared.tempIds().resolvedIds()).containsKeys("b", "v", "vb");
    }

    @Test
    void stopRequestEndsRunAtChunkBoundary() {
        InMemoryModelSubstrate substrate = new InMemoryModelSubstrate();
        Prepared prepared = prepare(substrate, Batch.of(List.of(
                createElement("a", "node", "A"),
                createElement("b", "node", "B"),
                createElement("c", "node", "C"))), 2);
        AtomicInteger checks = new AtomicInteger();

        ExecutionReport report = new TransactionExecutor(substrate).execute(prepared.plan(), prepared.tempIds(),
                () -> checks.incrementAndGet() > 1, ExecutionListener.NOOP);

        assertThat(report.stopped()).isTrue();
        assertThat(report.error()).isNull();
        assertThat(report.chunksCommitted()).isEqualTo(1);
        assertThat(report.results()).extracting(OperationResult::status).containsExactly(
                OperationStatus.CREATED, OperationStatus.UNEXECUTED, OperationStatus.UNEXECUTED);
    }

    @Test
    void substrateExceptionIsTreatedAsRollback() {
        ModelSubstrate substrate = mock(ModelSubstrate.class);
        when(substrate.commit(any(CommitUnit.class))).thenThrow(new IllegalStateException("stack is locked"));
        ObjectRef target = ObjectRef.committed("id-1");
        CompiledOperation op = new CompiledOperation(0, Ops.rename("id-1", "New"),
                List.of(Primitive.setField(target, "name", "New")),
                ResultPlan.builder(OperationStatus.UPDATED).subject(target).build());
        ChunkPlan plan = new ChunkPlanner().plan(List.of(op), 50, ExecutionGranularity.PER_BATCH_CHUNKING);

        ExecutionReport report = new TransactionExecutor(substrate).execute(plan, new TempIdTable(),
                () -> false, ExecutionListener.NOOP);

        assertThat(report.error().code()).isEqualTo(ErrorCode.CHUNK_ROLLBACK);
        assertThat(report.error().message()).contains("stack is locked");
        assertThat(report.results()).singleElement()
                .extracting(OperationResult::status).isEqualTo(OperationStatus.UNEXECUTED);
    }

    @Test
    void detailsCarryCommittedIdsAndNames() {
        InMemoryModelSubstrate substrate = new InMemoryModelSubstrate();
        Prepared prepared = prepare(substrate, Batch.of(List.of(
                createElement("a", "business-actor", "Customer"),
                createElement("b", "business-role", "Buyer"),
                Ops.createRelationship("r", "assignment-relationship", "a", "b"))), 50);

        ExecutionReport report = new TransactionExecutor(substrate).execute(prepared.plan(), prepared.tempIds(),
                () -> false, ExecutionListener.NOOP);

        OperationResult relationship = report.results().get(2);
        assertThat(relationship.tempId()).isEqualTo("r");
        assertThat(relationship.details())
                .containsEntry("sourceId", report.results().get(0).resolvedId())
                .containsEntry("targetId", report.results().get(1).resolvedId())
                .containsEntry("sourceName", "Customer")
                .containsEntry("targetName", "Buyer");
    }
}
