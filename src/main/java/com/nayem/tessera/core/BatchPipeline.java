package com.nayem.tessera.core;

import com.nayem.tessera.compile.CompiledOperation;
import com.nayem.tessera.compile.OperationCompiler;
import com.nayem.tessera.error.EngineError;
import com.nayem.tessera.error.ErrorCode;
import com.nayem.tessera.error.Result;
import com.nayem.tessera.execute.ExecutionListener;
import com.nayem.tessera.execute.ExecutionReport;
import com.nayem.tessera.execute.TransactionExecutor;
import com.nayem.tessera.job.Job;
import com.nayem.tessera.job.JobRunner;
import com.nayem.tessera.plan.Chunk;
import com.nayem.tessera.plan.ChunkPlan;
import com.nayem.tessera.plan.ChunkPlanner;
import com.nayem.tessera.validate.BatchValidator;
import com.nayem.tessera.validate.ValidatedBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Validate, compile, plan and execute one job.
 * <p>
 * Holds the writer gate for the whole run, so two jobs never touch the model
 * at the same time even if a timed-out run is still winding down.
 * </p>
 */
public class BatchPipeline implements JobRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchPipeline.class);

    static final String MDC_JOB_ID = "jobId";

    private final BatchValidator validator;
    private final OperationCompiler compiler;
    private final ChunkPlanner planner;
    private final TransactionExecutor executor;
    private final int maxSubCommandsPerChunk;
    private final EngineMetrics metrics;
    private final Clock clock;
    private final ReentrantLock writerGate = new ReentrantLock();

    public BatchPipeline(BatchValidator validator, OperationCompiler compiler, ChunkPlanner planner,
            TransactionExecutor executor, int maxSubCommandsPerChunk, EngineMetrics metrics, Clock clock) {
        this.validator = validator;
        this.compiler = compiler;
        this.planner = planner;
        this.executor = executor;
        this.maxSubCommandsPerChunk = maxSubCommandsPerChunk;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public ExecutionReport run(Job job, BooleanSupplier stop) {
        MDC.put(MDC_JOB_ID, job.id());
        try {
            writerGate.lockInterruptibly();
            try {
                return execute(job, stop);
            } finally {
                writerGate.unlock();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecutionReport.rejected(EngineError.of(ErrorCode.ENGINE_STOPPED,
                    "Interrupted while waiting for the model writer"), null);
        } finally {
            MDC.remove(MDC_JOB_ID);
        }
    }

    private ExecutionReport execute(Job job, BooleanSupplier stop) {
        if (stop.getAsBoolean()) {
            return new ExecutionReport(List.of(), null, 0, 0, null, true);
        }

        Result<ValidatedBatch> validated = validator.validate(job.batch());
        if (!validated.isOk()) {
            log.info("Batch rejected by validation: {}", validated.error());
            return ExecutionReport.rejected(validated.error(), null);
        }
        ValidatedBatch batch = validated.value();

        Result<List<CompiledOperation>> compiled = compiler.compileAll(batch);
        if (!compiled.isOk()) {
            log.info("Batch rejected during compilation: {}", compiled.error());
            return ExecutionReport.rejected(compiled.error(), batch.tempIds());
        }

        ChunkPlan plan = planner.plan(compiled.value(), maxSubCommandsPerChunk, batch.granularity());
        log.debug("Executing {} operation(s) in {} chunk(s), {} sub-commands", batch.size(), plan.size(),
                plan.totalSubCommands());

        return executor.execute(plan, batch.tempIds(), stop, new ExecutionListener() {
            @Override
            public void chunkCommitted(Chunk chunk, int chunkCount) {
                metrics.recordChunkCommitted();
                job.chunkCommitted(clock.instant(), chunk.index(), chunkCount, chunk.operations().size());
            }

            @Override
            public void chunkRolledBack(Chunk chunk, int chunkCount, String reason) {
                metrics.recordChunkRolledBack();
            }
        });
    }
}
