package com.nayem.tessera.job;

/**
 * Criteria for listing jobs.
 *
 * @param status only jobs in this status; null for all
 * @param limit  maximum number of jobs; null for the default
 */
public record JobFilter(JobStatus status, Integer limit) {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 200;

    public static JobFilter all() {
        return new JobFilter(null, null);
    }

    public static JobFilter byStatus(JobStatus status) {
        return new JobFilter(status, null);
    }

    public JobFilter withLimit(int limit) {
        return new JobFilter(status, limit);
    }

    /**
     * Limit clamped to {@code 1..MAX_LIMIT}.
     */
    public int effectiveLimit() {
        if (limit == null) {
            return DEFAULT_LIMIT;
        }
        return Math.max(1, Math.min(limit, MAX_LIMIT));
    }

    public boolean matches(Job job) {
        return status == null || job.status() == status;
    }
}
