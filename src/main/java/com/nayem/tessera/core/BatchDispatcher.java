package com.nayem.tessera.core;

import com.nayem.tessera.error.Result;
import com.nayem.tessera.job.JobFilter;
import com.nayem.tessera.job.JobSummary;
import com.nayem.tessera.job.JobView;
import com.nayem.tessera.operation.Batch;

import java.util.List;

/**
 * Entry point for the request-handling layer.
 */
public interface BatchDispatcher {

    int DEFAULT_PAGE_SIZE = 200;
    int MAX_PAGE_SIZE = 1000;

    /**
     * Accepts a batch for asynchronous execution. Returns at once; the batch
     * itself is validated when its job runs.
     */
    Result<SubmitReceipt> submit(Batch batch);

    Result<JobView> pollStatus(String jobId, int cursor, int pageSize, boolean summaryOnly);

    default Result<JobView> pollStatus(String jobId) {
        return pollStatus(jobId, 0, DEFAULT_PAGE_SIZE, false);
    }

    List<JobSummary> listJobs(JobFilter filter);

    EngineStats stats();
}
