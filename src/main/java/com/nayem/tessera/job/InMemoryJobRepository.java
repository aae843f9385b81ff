package com.nayem.tessera.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * In-memory implementation of JobRepository.
 * <p>
 * Suitable for:
 * - Development and testing
 * - Single-instance deployments
 * </p>
 * <p>
 * Note: Jobs are lost on restart. Terminal jobs are evicted {@code retention}
 * after they were last saved; queued and processing jobs never expire.
 * </p>
 */
public class InMemoryJobRepository implements JobRepository {

    public static final Duration DEFAULT_RETENTION = Duration.ofHours(1);

    private final Cache<String, Job> jobs;

    public InMemoryJobRepository(Clock clock) {
        this(clock, DEFAULT_RETENTION);
    }

    public InMemoryJobRepository(Clock clock, Duration retention) {
        Ticker ticker = () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
        this.jobs = Caffeine.newBuilder()
                .expireAfter(new RetentionExpiry(retention))
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    @Override
    public void save(Job job) {
        jobs.put(job.id(), job);
    }

    @Override
    public Optional<Job> findById(String jobId) {
        return Optional.ofNullable(jobs.getIfPresent(jobId));
    }

    @Override
    public List<Job> find(JobFilter filter) {
        jobs.cleanUp();
        return jobs.asMap().values().stream()
                .filter(filter::matches)
                .sorted(Comparator.comparing(Job::submittedAt).reversed().thenComparing(Job::id,
                        Comparator.reverseOrder()))
                .limit(filter.effectiveLimit())
                .toList();
    }

    @Override
    public long count(JobStatus status) {
        jobs.cleanUp();
        return jobs.asMap().values().stream().filter(job -> job.status() == status).count();
    }

    @Override
    public void delete(String jobId) {
        jobs.invalidate(jobId);
    }

    /**
     * Clears all stored jobs. Useful for testing.
     */
    public void clear() {
        jobs.invalidateAll();
    }

    /**
     * Returns the current number of stored jobs.
     */
    public long size() {
        jobs.cleanUp();
        return jobs.estimatedSize();
    }

    private static final class RetentionExpiry implements Expiry<String, Job> {

        private final long retentionNanos;

        private RetentionExpiry(Duration retention) {
            this.retentionNanos = retention.toNanos();
        }

        @Override
        public long expireAfterCreate(String key, Job job, long currentTime) {
            return job.isTerminal() ? retentionNanos : Long.MAX_VALUE;
        }

        @Override
        public long expireAfterUpdate(String key, Job job, long currentTime, long currentDuration) {
            return job.isTerminal() ? retentionNanos : Long.MAX_VALUE;
        }

        @Override
        public long expireAfterRead(String key, Job job, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
