package com.nayem.tessera.spring;

import com.nayem.tessera.compile.DuplicateErrorMode;
import com.nayem.tessera.compile.OperationFailurePolicy;
import com.nayem.tessera.operation.ExecutionGranularity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Configuration properties for the Tessera batch engine.
 * <p>
 * These properties can be configured in {@code application.yml} under the
 * {@code tessera} prefix.
 * </p>
 */
@ConfigurationProperties(prefix = "tessera")
@Validated
public class TesseraProperties {

    /**
     * Whether the engine bean is created.
     */
    private boolean enabled = true;

    /**
     * Maximum number of operations accepted in one batch.
     */
    @Min(1)
    @Max(1000)
    private int maxChanges = 1000;

    /**
     * Maximum sub-commands per commit unit. Keep it below the substrate's silent
     * rollback ceiling. 0 commits each batch as one unit.
     */
    @Min(0)
    private int maxSubCommandsPerChunk = 50;

    /**
     * Chunking mode for batches that do not choose one.
     */
    @NotNull
    private ExecutionGranularity defaultGranularity = ExecutionGranularity.PER_BATCH_CHUNKING;

    /**
     * What a duplicate under the 'error' strategy does: abort the batch or skip
     * the operation.
     */
    @NotNull
    private DuplicateErrorMode duplicateErrorMode = DuplicateErrorMode.ABORT_BATCH;

    /**
     * Whether direction and ambiguity failures skip the operation or abort the
     * batch.
     */
    @NotNull
    private OperationFailurePolicy operationFailurePolicy = OperationFailurePolicy.CONTINUE;

    /**
     * Whether each commit is checked against the model afterwards.
     */
    private boolean postCommitVerification = true;

    /**
     * Jobs allowed to wait for the writer before submissions are rejected.
     */
    @Min(1)
    private int maxQueuedJobs = 1000;

    /**
     * Hard timeout per job. Committed chunks stay committed when it fires.
     */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration jobTimeout = Duration.ofSeconds(60);

    /**
     * How long finished jobs stay pollable.
     */
    @DurationUnit(ChronoUnit.MINUTES)
    private Duration jobRetention = Duration.ofHours(1);

    /**
     * Maximum time to wait for queued and running jobs during application
     * shutdown.
     */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration shutdownTimeout = Duration.ofSeconds(10);

    /**
     * How frequently to poll for shutdown completion.
     */
    @DurationUnit(ChronoUnit.MILLIS)
    private Duration shutdownPollingInterval = Duration.ofMillis(100);

    /**
     * Prefix for engine thread names.
     */
    private String threadNamePrefix = "tessera-";

    /**
     * Configuration for idempotent replay.
     */
    @Valid
    private Idempotency idempotency = new Idempotency();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxChanges() {
        return maxChanges;
    }

    public void setMaxChanges(int maxChanges) {
        this.maxChanges = maxChanges;
    }

    public int getMaxSubCommandsPerChunk() {
        return maxSubCommandsPerChunk;
    }

    public void setMaxSubCommandsPerChunk(int maxSubCommandsPerChunk) {
        this.maxSubCommandsPerChunk = maxSubCommandsPerChunk;
    }

    public ExecutionGranularity getDefaultGranularity() {
        return defaultGranularity;
    }

    public void setDefaultGranularity(ExecutionGranularity defaultGranularity) {
        this.defaultGranularity = defaultGranularity;
    }

    public DuplicateErrorMode getDuplicateErrorMode() {
        return duplicateErrorMode;
    }

    public void setDuplicateErrorMode(DuplicateErrorMode duplicateErrorMode) {
        this.duplicateErrorMode = duplicateErrorMode;
    }

    public OperationFailurePolicy getOperationFailurePolicy() {
        return operationFailurePolicy;
    }

    public void setOperationFailurePolicy(OperationFailurePolicy operationFailurePolicy) {
        this.operationFailurePolicy = operationFailurePolicy;
    }

    public boolean isPostCommitVerification() {
        return postCommitVerification;
    }

    public void setPostCommitVerification(boolean postCommitVerification) {
        this.postCommitVerification = postCommitVerification;
    }

    public int getMaxQueuedJobs() {
        return maxQueuedJobs;
    }

    public void setMaxQueuedJobs(int maxQueuedJobs) {
        this.maxQueuedJobs = maxQueuedJobs;
    }

    public Duration getJobTimeout() {
        return jobTimeout;
    }

    public void setJobTimeout(Duration jobTimeout) {
        this.jobTimeout = jobTimeout;
    }

    public Duration getJobRetention() {
        return jobRetention;
    }

    public void setJobRetention(Duration jobRetention) {
        this.jobRetention = jobRetention;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public Duration getShutdownPollingInterval() {
        return shutdownPollingInterval;
    }

    public void setShutdownPollingInterval(Duration shutdownPollingInterval) {
        this.shutdownPollingInterval = shutdownPollingInterval;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public void setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
    }

    /**
     * Gets the idempotency configuration.
     *
     * @return the idempotency configuration
     */
    public Idempotency getIdempotency() {
        return idempotency;
    }

    /**
     * Sets the idempotency configuration.
     *
     * @param idempotency the idempotency configuration
     */
    public void setIdempotency(Idempotency idempotency) {
        this.idempotency = idempotency;
    }

    /**
     * Configuration for idempotency keys.
     * <p>
     * A request repeated with the same key and payload within the ttl is
     * answered from the stored result instead of running again.
     * </p>
     */
    public static class Idempotency {
        /**
         * Replay window, counted from job completion.
         */
        @DurationUnit(ChronoUnit.HOURS)
        private Duration ttl = Duration.ofHours(24);

        /**
         * Maximum number of stored keys. The least recently used are dropped
         * first.
         */
        @Min(1)
        private long maxRecords = 10_000;

        /** @return the replay window */
        public Duration getTtl() {
            return ttl;
        }

        /** @param ttl the replay window */
        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        /** @return the maximum number of stored keys */
        public long getMaxRecords() {
            return maxRecords;
        }

        /** @param maxRecords the maximum number of stored keys */
        public void setMaxRecords(long maxRecords) {
            this.maxRecords = maxRecords;
        }
    }
}
