package com.nayem.tessera.core;

import com.nayem.tessera.job.JobStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Micrometer metrics for job throughput, chunk commits and idempotency.
 */
public class EngineMetrics {

    private final MeterRegistry registry;
    private final Counter submittedCounter;
    private final Map<JobStatus, Counter> completedCounters;
    private final Timer jobDurationTimer;
    private final Counter chunksCommittedCounter;
    private final Counter chunksRolledBackCounter;
    private final Counter replayCounter;
    private final Counter conflictCounter;

    public EngineMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.completedCounters = new EnumMap<>(JobStatus.class);

        if (registry != null) {
            this.submittedCounter = Counter.builder("tessera.jobs.submitted")
                    .description("Number of batches accepted for execution")
                    .register(registry);

            for (JobStatus status : new JobStatus[] { JobStatus.COMPLETE, JobStatus.ERROR }) {
                completedCounters.put(status, Counter.builder("tessera.jobs.completed")
                        .description("Number of jobs that reached a terminal state")
                        .tag("status", status.wireName())
                        .register(registry));
            }

            this.jobDurationTimer = Timer.builder("tessera.job.duration")
                    .description("Processing time per job")
                    .register(registry);

            this.chunksCommittedCounter = Counter.builder("tessera.chunks.committed")
                    .description("Number of chunks committed and verified")
                    .register(registry);

            this.chunksRolledBackCounter = Counter.builder("tessera.chunks.rolledback")
                    .description("Number of chunks rolled back by the substrate")
                    .register(registry);

            this.replayCounter = Counter.builder("tessera.idempotency.replays")
                    .description("Number of requests answered from the idempotency cache")
                    .register(registry);

            this.conflictCounter = Counter.builder("tessera.idempotency.conflicts")
                    .description("Number of idempotency keys reused with a different payload")
                    .register(registry);
        } else {
            this.submittedCounter = null;
            this.jobDurationTimer = null;
            this.chunksCommittedCounter = null;
            this.chunksRolledBackCounter = null;
            this.replayCounter = null;
            this.conflictCounter = null;
        }
    }

    /**
     * Registers the queue depth gauge.
     */
    public void bindQueueDepth(Supplier<Number> queued) {
        if (registry != null) {
            Gauge.builder("tessera.jobs.queued", queued)
                    .description("Number of jobs waiting for the writer")
                    .register(registry);
        }
    }

    public void recordSubmitted() {
        if (submittedCounter != null) {
            submittedCounter.increment();
        }
    }

    public void recordCompleted(JobStatus status, Long durationMs) {
        Counter counter = completedCounters.get(status);
        if (counter != null) {
            counter.increment();
        }
        if (jobDurationTimer != null && durationMs != null) {
            jobDurationTimer.record(durationMs, TimeUnit.MILLISECONDS);
        }
    }

    public void recordChunkCommitted() {
        if (chunksCommittedCounter != null) {
            chunksCommittedCounter.increment();
        }
    }

    public void recordChunkRolledBack() {
        if (chunksRolledBackCounter != null) {
            chunksRolledBackCounter.increment();
        }
    }

    public void recordReplay() {
        if (replayCounter != null) {
            replayCounter.increment();
        }
    }

    public void recordConflict() {
        if (conflictCounter != null) {
            conflictCounter.increment();
        }
    }

    public static EngineMetrics noOp() {
        return new EngineMetrics(null);
    }
}
