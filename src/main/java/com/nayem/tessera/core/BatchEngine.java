package com.nayem.tessera.core;

import com.nayem.tessera.compile.ConnectionResolver;
import com.nayem.tessera.compile.DuplicateErrorMode;
import com.nayem.tessera.compile.OperationCompiler;
import com.nayem.tessera.compile.OperationFailurePolicy;
import com.nayem.tessera.error.EngineError;
import com.nayem.tessera.error.ErrorCode;
import com.nayem.tessera.error.Result;
import com.nayem.tessera.execute.ResultCollector;
import com.nayem.tessera.execute.TransactionExecutor;
import com.nayem.tessera.idempotency.IdempotencyCache;
import com.nayem.tessera.idempotency.IdempotencyMeta;
import com.nayem.tessera.idempotency.IdempotencyRecord;
import com.nayem.tessera.idempotency.PayloadFingerprinter;
import com.nayem.tessera.idempotency.Reservation;
import com.nayem.tessera.job.InMemoryJobRepository;
import com.nayem.tessera.job.Job;
import com.nayem.tessera.job.JobFilter;
import com.nayem.tessera.job.JobListener;
import com.nayem.tessera.job.JobQueue;
import com.nayem.tessera.job.JobRepository;
import com.nayem.tessera.job.JobStatus;
import com.nayem.tessera.job.JobSummary;
import com.nayem.tessera.job.JobView;
import com.nayem.tessera.model.ModelSubstrate;
import com.nayem.tessera.operation.Batch;
import com.nayem.tessera.operation.ExecutionGranularity;
import com.nayem.tessera.plan.ChunkPlanner;
import com.nayem.tessera.validate.BatchValidator;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the job table, the idempotency cache and the single-writer queue for
 * one model.
 * <p>
 * Submitting never blocks on execution: the batch is queued and its job id
 * returned. Jobs run one at a time, in submission order, until
 * {@link #shutdown()}.
 * </p>
 */
public class BatchEngine implements BatchDispatcher, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BatchEngine.class);

    private static final char[] ID_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789".toCharArray();

    private final Clock clock;
    private final JobRepository jobs;
    private final JobQueue queue;
    private final IdempotencyCache<JobView> idempotency;
    private final PayloadFingerprinter fingerprinter;
    private final EngineMetrics metrics;
    private final Duration shutdownTimeout;
    private final Duration shutdownPollingInterval;
    private final ExecutorService workerExecutor;
    private final ExecutorService pipelineExecutor;
    private final SecureRandom random = new SecureRandom();

    private volatile boolean accepting;

    BatchEngine(Builder builder) {
        this.clock = builder.clock;
        this.jobs = builder.jobRepository != null ? builder.jobRepository
                : new InMemoryJobRepository(builder.clock, builder.jobRetention);
        this.idempotency = new IdempotencyCache<>(builder.clock, builder.idempotencyTtl,
                builder.idempotencyMaxRecords);
        this.fingerprinter = new PayloadFingerprinter();
        this.metrics = new EngineMetrics(builder.registry);
        this.shutdownTimeout = builder.shutdownTimeout;
        this.shutdownPollingInterval = builder.shutdownPollingInterval;
        this.workerExecutor = Executors.newCachedThreadPool(threadFactory(builder.threadNamePrefix + "worker-"));
        this.pipelineExecutor = Executors.newCachedThreadPool(threadFactory(builder.threadNamePrefix + "pipeline-"));

        ModelSubstrate substrate = builder.substrate;
        BatchPipeline pipeline = new BatchPipeline(
                new BatchValidator(substrate, builder.maxChanges, builder.defaultGranularity),
                new OperationCompiler(substrate, new ConnectionResolver(), builder.duplicateErrorMode,
                        builder.operationFailurePolicy),
                new ChunkPlanner(),
                new TransactionExecutor(substrate, new ResultCollector(substrate), builder.postCommitVerification),
                builder.maxSubCommandsPerChunk,
                metrics,
                clock);
        this.queue = new JobQueue(pipeline, jobs, new TerminalJobHandler(), clock, builder.maxQueuedJobs,
                builder.jobTimeout, workerExecutor, pipelineExecutor);
        metrics.bindQueueDepth(queue::queuedCount);
    }

    /**
     * Starts accepting submissions.
     */
    public BatchEngine start() {
        accepting = true;
        log.info("BatchEngine started");
        return this;
    }

    public boolean isAccepting() {
        return accepting;
    }

    @Override
    public Result<SubmitReceipt> submit(Batch batch) {
        if (!accepting) {
            return Result.err(EngineError.of(ErrorCode.ENGINE_STOPPED, "Engine is not accepting batches"));
        }
        if (batch == null) {
            return Result.err(EngineError.of(ErrorCode.VALIDATION_ERROR, "Request body is empty"));
        }

        String key = batch.idempotencyKey();
        String jobId = newJobId();
        IdempotencyRecord<JobView> reserved = null;
        if (key != null) {
            Optional<EngineError> invalidKey = BatchValidator.checkIdempotencyKey(key);
            if (invalidKey.isPresent()) {
                return Result.err(invalidKey.get());
            }
            Reservation<JobView> reservation = idempotency.reserve(key, fingerprinter.fingerprint(batch), jobId);
            if (reservation instanceof Reservation.Replay<JobView> replay) {
                return replay(replay.record());
            }
            if (reservation instanceof Reservation.Conflict<JobView> conflict) {
                metrics.recordConflict();
                return Result.err(EngineError.of(ErrorCode.IDEMPOTENCY_CONFLICT,
                        "Idempotency key '" + key + "' was already used with a different payload (job "
                                + conflict.record().jobId() + ")")
                        .withReference(key)
                        .withHint("Use a new idempotency key, or resubmit the original payload to replay it"));
            }
            reserved = reservation.record();
        }

        Job job = new Job(jobId, batch, clock.instant(), key);
        if (reserved != null) {
            job.idempotency(IdempotencyMeta.of(reserved, false));
        }
        Result<Job> enqueued = queue.enqueue(job);
        if (!enqueued.isOk()) {
            if (key != null) {
                idempotency.release(key, jobId);
            }
            return Result.err(enqueued.error());
        }
        metrics.recordSubmitted();
        log.debug("Queued job {} with {} operation(s)", jobId, batch.size());
        return Result.ok(SubmitReceipt.queued(job.view(0, 0, true)));
    }

    private Result<SubmitReceipt> replay(IdempotencyRecord<JobView> record) {
        metrics.recordReplay();
        IdempotencyMeta meta = IdempotencyMeta.of(record, true);
        if (record.result() != null) {
            return Result.ok(SubmitReceipt.replay(record.result().asReplay(meta)));
        }
        return jobs.findById(record.jobId())
                .map(job -> Result.ok(SubmitReceipt.replay(job.view(0, DEFAULT_PAGE_SIZE, false).asReplay(meta))))
                .orElseGet(() -> Result.err(EngineError.of(ErrorCode.JOB_NOT_FOUND,
                        "Job " + record.jobId() + " for idempotency key '" + record.key() + "' is gone")
                        .withReference(record.jobId())));
    }

    @Override
    public Result<JobView> pollStatus(String jobId, int cursor, int pageSize, boolean summaryOnly) {
        if (cursor < 0) {
            return Result.err(EngineError.of(ErrorCode.VALIDATION_ERROR, "cursor must be >= 0, was " + cursor));
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            return Result.err(EngineError.of(ErrorCode.VALIDATION_ERROR,
                    "pageSize must be between 1 and " + MAX_PAGE_SIZE + ", was " + pageSize));
        }
        return jobs.findById(jobId)
                .map(job -> Result.ok(job.view(cursor, pageSize, summaryOnly)))
                .orElseGet(() -> Result.err(EngineError.of(ErrorCode.JOB_NOT_FOUND,
                        "No job with id '" + jobId + "'").withReference(jobId)
                        .withHint("Jobs are kept for a limited time after they finish")));
    }

    @Override
    public List<JobSummary> listJobs(JobFilter filter) {
        return jobs.find(filter != null ? filter : JobFilter.all()).stream()
                .map(Job::summary)
                .toList();
    }

    @Override
    public EngineStats stats() {
        return new EngineStats(
                jobs.count(JobStatus.QUEUED),
                jobs.count(JobStatus.PROCESSING),
                jobs.count(JobStatus.COMPLETE),
                jobs.count(JobStatus.ERROR),
                idempotency.size());
    }

    /**
     * Removes expired idempotency records.
     */
    public int purgeExpiredIdempotencyRecords() {
        return idempotency.purgeExpired();
    }

    @Override
    public void close() {
        shutdown();
    }

    public void shutdown() {
        shutdown(shutdownTimeout);
    }

    /**
     * Stops accepting batches and waits up to {@code timeout} for queued and
     * running jobs to finish. Jobs still queued afterwards end with
     * {@code EngineStopped}; a job still running is asked to stop at its next
     * chunk boundary.
     */
    public void shutdown(Duration timeout) {
        accepting = false;
        log.info("BatchEngine shutting down, draining {} queued job(s)...", queue.queuedCount());

        long start = System.currentTimeMillis();
        long timeoutMs = timeout.toMillis();
        long pollingMs = shutdownPollingInterval.toMillis();

        while (queue.isRunning() && System.currentTimeMillis() - start < timeoutMs) {
            try {
                TimeUnit.MILLISECONDS.sleep(pollingMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Shutdown interrupted with jobs still active");
                break;
            }
        }

        if (queue.isRunning()) {
            EngineError stopped = EngineError.of(ErrorCode.ENGINE_STOPPED, "Engine shut down before the job ran");
            List<Job> abandoned = queue.drainQueued();
            log.warn("Shutdown timeout ({}ms) exceeded, failing {} queued job(s)", timeoutMs, abandoned.size());
            for (Job job : abandoned) {
                if (job.fail(clock.instant(), stopped)) {
                    jobs.save(job);
                    onTerminal(job);
                }
            }
            queue.stopCurrent(EngineError.of(ErrorCode.ENGINE_STOPPED,
                    "Engine shut down while the job was running; committed chunks stay committed"));
        } else {
            log.info("All jobs drained in {}ms", System.currentTimeMillis() - start);
        }

        workerExecutor.shutdown();
        pipelineExecutor.shutdown();
        try {
            if (!workerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Worker executor did not terminate in 5 seconds, forcing shutdown");
                workerExecutor.shutdownNow();
            }
            if (!pipelineExecutor.awaitTermination(1, TimeUnit.SECONDS)) {
                pipelineExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workerExecutor.shutdownNow();
            pipelineExecutor.shutdownNow();
        }

        log.info("BatchEngine shutdown complete.");
    }

    private void onTerminal(Job job) {
        String key = job.idempotencyKey();
        if (key != null) {
            if (job.status() == JobStatus.COMPLETE) {
                idempotency.complete(key, job.id(), job.view(0, Integer.MAX_VALUE, false))
                        .ifPresent(record -> job.idempotency(IdempotencyMeta.of(record, false)));
            } else {
                idempotency.release(key, job.id());
            }
        }
        metrics.recordCompleted(job.status(), job.durationMs());
    }

    private String newJobId() {
        StringBuilder suffix = new StringBuilder(8);
        for (int i = 0; i < 8; i++) {
            suffix.append(ID_ALPHABET[random.nextInt(ID_ALPHABET.length)]);
        }
        return "op_" + clock.millis() + "_" + suffix;
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private final class TerminalJobHandler implements JobListener {
        @Override
        public void jobFinished(Job job) {
            onTerminal(job);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for creating a {@link BatchEngine} instance.
     * <p>
     * Only the substrate is required. Every other setting has the default
     * documented on its setter.
     * </p>
     */
    public static class Builder {
        private ModelSubstrate substrate;
        private Clock clock = Clock.systemUTC();
        private MeterRegistry registry;
        private JobRepository jobRepository;
        private int maxChanges = BatchValidator.HARD_MAX_CHANGES;
        private int maxSubCommandsPerChunk = ChunkPlanner.DEFAULT_CEILING;
        private ExecutionGranularity defaultGranularity = ExecutionGranularity.PER_BATCH_CHUNKING;
        private DuplicateErrorMode duplicateErrorMode = DuplicateErrorMode.ABORT_BATCH;
        private OperationFailurePolicy operationFailurePolicy = OperationFailurePolicy.CONTINUE;
        private boolean postCommitVerification = true;
        private int maxQueuedJobs = 1000;
        private Duration jobTimeout = Duration.ofSeconds(60);
        private Duration jobRetention = InMemoryJobRepository.DEFAULT_RETENTION;
        private Duration idempotencyTtl = IdempotencyCache.DEFAULT_TTL;
        private long idempotencyMaxRecords = IdempotencyCache.DEFAULT_MAX_RECORDS;
        private Duration shutdownTimeout = Duration.ofSeconds(10);
        private Duration shutdownPollingInterval = Duration.ofMillis(100);
        private String threadNamePrefix = "tessera-";

        /**
         * Sets the model the engine writes to. Required.
         *
         * @param substrate the transactional command substrate
         * @return this builder
         */
        public Builder substrate(ModelSubstrate substrate) {
            this.substrate = substrate;
            return this;
        }

        /**
         * Sets the clock for timestamps, job retention and idempotency expiry.
         * <p>
         * Default is the system UTC clock.
         * </p>
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Sets the Micrometer registry for recording metrics.
         *
         * @param registry The Micrometer registry.
         * @return this builder
         */
        public Builder metrics(MeterRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Sets the job store. Default is an {@link InMemoryJobRepository} with
         * the configured retention.
         *
         * @param jobRepository the job store
         * @return this builder
         */
        public Builder jobRepository(JobRepository jobRepository) {
            this.jobRepository = jobRepository;
            return this;
        }

        /**
         * Sets the maximum number of operations per batch, at most 1000.
         *
         * @param maxChanges operation cap
         * @return this builder
         */
        public Builder maxChanges(int maxChanges) {
            this.maxChanges = maxChanges;
            return this;
        }

        /**
         * Sets the sub-command ceiling per commit unit.
         * <p>
         * Default is 50. 0 submits each batch as a single unit.
         * </p>
         *
         * @param ceiling maximum sub-commands per chunk
         * @return this builder
         */
        public Builder maxSubCommandsPerChunk(int ceiling) {
            this.maxSubCommandsPerChunk = ceiling;
            return this;
        }

        /**
         * Sets the chunking mode for batches that do not choose one.
         *
         * @param granularity default granularity
         * @return this builder
         */
        public Builder defaultGranularity(ExecutionGranularity granularity) {
            this.defaultGranularity = granularity;
            return this;
        }

        /**
         * Sets what a duplicate under the {@code error} strategy does.
         * <p>
         * Default is {@link DuplicateErrorMode#ABORT_BATCH}.
         * </p>
         *
         * @param mode duplicate error mode
         * @return this builder
         */
        public Builder duplicateErrorMode(DuplicateErrorMode mode) {
            this.duplicateErrorMode = mode;
            return this;
        }

        /**
         * Sets whether direction and ambiguity failures skip the operation or
         * abort the batch.
         * <p>
         * Default is {@link OperationFailurePolicy#CONTINUE}.
         * </p>
         *
         * @param policy failure policy
         * @return this builder
         */
        public Builder operationFailurePolicy(OperationFailurePolicy policy) {
            this.operationFailurePolicy = policy;
            return this;
        }

        /**
         * Sets whether each commit is checked against the model afterwards.
         * Without it, silently discarded units go unnoticed. Default is true.
         *
         * @param enabled whether to verify commits
         * @return this builder
         */
        public Builder postCommitVerification(boolean enabled) {
            this.postCommitVerification = enabled;
            return this;
        }

        /**
         * Sets how many jobs may wait for the writer before submissions fail
         * with {@code QueueFull}. Default is 1000.
         *
         * @param maxQueuedJobs queue bound
         * @return this builder
         */
        public Builder maxQueuedJobs(int maxQueuedJobs) {
            this.maxQueuedJobs = maxQueuedJobs;
            return this;
        }

        /**
         * Sets the hard timeout per job. Default is 60 seconds.
         *
         * @param timeout job timeout
         * @return this builder
         */
        public Builder jobTimeout(Duration timeout) {
            this.jobTimeout = timeout;
            return this;
        }

        /**
         * Sets how long finished jobs stay pollable. Default is 1 hour.
         *
         * @param retention retention of terminal jobs
         * @return this builder
         */
        public Builder jobRetention(Duration retention) {
            this.jobRetention = retention;
            return this;
        }

        /**
         * Sets the replay window for idempotency keys. Default is 24 hours.
         *
         * @param ttl idempotency ttl
         * @return this builder
         */
        public Builder idempotencyTtl(Duration ttl) {
            this.idempotencyTtl = ttl;
            return this;
        }

        /**
         * Sets the maximum number of idempotency records. Default is 10000.
         *
         * @param maxRecords record cap
         * @return this builder
         */
        public Builder idempotencyMaxRecords(long maxRecords) {
            this.idempotencyMaxRecords = maxRecords;
            return this;
        }

        /**
         * Sets the grace period for draining jobs during shutdown.
         * <p>
         * Default is 10 seconds.
         * </p>
         *
         * @param timeout The shutdown timeout.
         * @return this builder
         */
        public Builder shutdownTimeout(Duration timeout) {
            this.shutdownTimeout = timeout;
            return this;
        }

        /**
         * Sets the interval to check for running jobs during shutdown.
         * <p>
         * Default is 100ms.
         * </p>
         *
         * @param interval The polling interval.
         * @return this builder
         */
        public Builder shutdownPollingInterval(Duration interval) {
            this.shutdownPollingInterval = interval;
            return this;
        }

        /**
         * Sets the prefix for threads created by this engine. Default is
         * "tessera-".
         *
         * @param prefix The thread name prefix.
         * @return this builder
         */
        public Builder threadNamePrefix(String prefix) {
            this.threadNamePrefix = prefix;
            return this;
        }

        /**
         * Builds a configured {@link BatchEngine}. Call {@link BatchEngine#start()}
         * before submitting.
         *
         * @return The new engine instance.
         * @throws IllegalStateException if the substrate is missing or a limit is
         *                               out of range.
         */
        public BatchEngine build() {
            if (substrate == null) {
                throw new IllegalStateException("A ModelSubstrate is required.");
            }
            if (maxChanges < 1 || maxChanges > BatchValidator.HARD_MAX_CHANGES) {
                throw new IllegalStateException("maxChanges must be between 1 and "
                        + BatchValidator.HARD_MAX_CHANGES);
            }
            if (maxSubCommandsPerChunk < 0) {
                throw new IllegalStateException("maxSubCommandsPerChunk must be >= 0");
            }
            if (maxQueuedJobs < 1) {
                throw new IllegalStateException("maxQueuedJobs must be >= 1");
            }
            return new BatchEngine(this);
        }
    }
}
