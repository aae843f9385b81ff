package com.nayem.tessera.job;

/**
 * Lifecycle callbacks from the job queue, invoked on the worker thread.
 */
public interface JobListener {

    JobListener NOOP = new JobListener() {
    };

    default void jobStarted(Job job) {
    }

    /**
     * Called once per job, after it reached a terminal state and was saved.
     */
    default void jobFinished(Job job) {
    }
}
