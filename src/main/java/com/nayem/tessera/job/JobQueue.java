package com.nayem.tessera.job;

import com.nayem.tessera.error.EngineError;
import com.nayem.tessera.error.ErrorCode;
import com.nayem.tessera.error.Result;
import com.nayem.tessera.execute.ExecutionReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FIFO queue with a single active writer.
 * <p>
 * The worker loop is started when work arrives and exits when the queue is
 * empty, so at most one job is processing at any time. Each job runs on the
 * pipeline executor under a hard timeout; a timed-out run is asked to stop at
 * its next chunk boundary and the job ends in {@code error}.
 * </p>
 */
public class JobQueue {

    private static final Logger log = LoggerFactory.getLogger(JobQueue.class);

    static final Duration STOP_GRACE = Duration.ofSeconds(5);

    private final JobRunner runner;
    private final JobRepository repository;
    private final JobListener listener;
    private final Clock clock;
    private final int maxQueuedJobs;
    private final Duration jobTimeout;
    private final ExecutorService workerExecutor;
    private final ExecutorService pipelineExecutor;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Job> pending = new ArrayDeque<>();
    private final AtomicReference<AtomicReference<EngineError>> currentStop = new AtomicReference<>();
    private volatile boolean isRunning;

    public JobQueue(JobRunner runner, JobRepository repository, JobListener listener, Clock clock,
            int maxQueuedJobs, Duration jobTimeout, ExecutorService workerExecutor,
            ExecutorService pipelineExecutor) {
        this.runner = runner;
        this.repository = repository;
        this.listener = listener;
        this.clock = clock;
        this.maxQueuedJobs = maxQueuedJobs;
        this.jobTimeout = jobTimeout;
        this.workerExecutor = workerExecutor;
        this.pipelineExecutor = pipelineExecutor;
    }

    /**
     * Adds a queued job. Thread-safe, non-blocking.
     *
     * @return the job, or {@code QueueFull} when {@code maxQueuedJobs} jobs are
     *         already waiting
     */
    public Result<Job> enqueue(Job job) {
        lock.lock();
        try {
            if (pending.size() >= maxQueuedJobs) {
                return Result.err(EngineError.of(ErrorCode.QUEUE_FULL,
                        "Job queue is full (" + maxQueuedJobs + " queued jobs)")
                        .withHint("Poll running jobs and resubmit once the queue drains"));
            }
            repository.save(job);
            pending.addLast(job);

            if (!isRunning) {
                isRunning = true;
                workerExecutor.execute(this::runLoop);
            }
        } finally {
            lock.unlock();
        }
        return Result.ok(job);
    }

    /**
     * Whether the worker loop is active: a job is processing or waiting.
     */
    public boolean isRunning() {
        return isRunning;
    }

    public int queuedCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every job still waiting and returns them in queue order. The
     * running job, if any, is not affected.
     */
    public List<Job> drainQueued() {
        lock.lock();
        try {
            List<Job> drained = new ArrayList<>(pending);
            pending.clear();
            return drained;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Asks the running job, if any, to stop at its next chunk boundary.
     */
    public void stopCurrent(EngineError reason) {
        AtomicReference<EngineError> stop = currentStop.get();
        if (stop != null) {
            stop.compareAndSet(null, reason);
        }
    }

    private void runLoop() {
        while (true) {
            Job job;

            lock.lock();
            try {
                job = pending.pollFirst();
                if (job == null) {
                    isRunning = false;
                    return;
                }
            } finally {
                lock.unlock();
            }

            try {
                process(job);
            } catch (RuntimeException e) {
                log.error("Unexpected failure while processing job {}", job.id(), e);
                if (job.fail(clock.instant(), EngineError.of(ErrorCode.INTERNAL_ERROR,
                        "Unexpected failure: " + e.getMessage()))) {
                    finished(job);
                }
            }
        }
    }

    private void process(Job job) {
        if (!job.start(clock.instant())) {
            return;
        }
        repository.save(job);
        listener.jobStarted(job);

        AtomicReference<EngineError> stop = new AtomicReference<>();
        currentStop.set(stop);
        try {
            CompletableFuture<ExecutionReport> running = CompletableFuture
                    .supplyAsync(() -> runner.run(job, () -> stop.get() != null), pipelineExecutor);
            try {
                ExecutionReport report = running.copy()
                        .orTimeout(jobTimeout.toMillis(), TimeUnit.MILLISECONDS)
                        .join();
                job.finish(clock.instant(), report, stop.get());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof TimeoutException) {
                    timedOut(job, running, stop);
                } else {
                    log.error("Job {} failed unexpectedly", job.id(), cause);
                    job.fail(clock.instant(), EngineError.of(ErrorCode.INTERNAL_ERROR,
                            "Unexpected failure: " + cause.getMessage()));
                }
            }
        } finally {
            currentStop.set(null);
        }
        finished(job);
    }

    private void timedOut(Job job, CompletableFuture<ExecutionReport> running,
            AtomicReference<EngineError> stop) {
        EngineError timeout = EngineError.of(ErrorCode.TIMEOUT,
                "Job exceeded its " + jobTimeout.toMillis() + "ms timeout; committed chunks stay committed");
        stop.compareAndSet(null, timeout);
        log.warn("Job {} timed out after {}ms, stopping at the next chunk boundary", job.id(),
                jobTimeout.toMillis());

        try {
            ExecutionReport partial = running.get(STOP_GRACE.toMillis(), TimeUnit.MILLISECONDS);
            job.finish(clock.instant(), partial, stop.get());
        } catch (TimeoutException e) {
            log.warn("Job {} did not reach a chunk boundary within {}ms", job.id(), STOP_GRACE.toMillis());
            job.fail(clock.instant(), stop.get());
        } catch (ExecutionException e) {
            log.error("Job {} failed after its timeout", job.id(), e.getCause());
            job.fail(clock.instant(), stop.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            job.fail(clock.instant(), stop.get());
        }
    }

    private void finished(Job job) {
        repository.save(job);
        log.info("Job {} finished with status {}", job.id(), job.status().wireName());
        listener.jobFinished(job);
    }
}
