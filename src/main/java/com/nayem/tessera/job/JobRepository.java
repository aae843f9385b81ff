package com.nayem.tessera.job;

import java.util.List;
import java.util.Optional;

/**
 * Storage for jobs.
 * <p>
 * Implementations decide how long terminal jobs are kept. Running jobs must
 * never be evicted.
 * </p>
 */
public interface JobRepository {

    /**
     * Stores or refreshes a job. Called again on every terminal transition so
     * retention can start counting.
     */
    void save(Job job);

    Optional<Job> findById(String jobId);

    /**
     * Jobs matching the filter, most recently submitted first, up to the
     * filter's limit.
     */
    List<Job> find(JobFilter filter);

    long count(JobStatus status);

    void delete(String jobId);
}
