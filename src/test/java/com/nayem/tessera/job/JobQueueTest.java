package com.nayem.tessera.job;

import com.nayem.tessera.error.ErrorCode;
import com.nayem.tessera.error.Result;
import com.nayem.tessera.execute.ExecutionReport;
import com.nayem.tessera.operation.Batch;
import com.nayem.tessera.support.Poll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.nayem.tessera.support.Ops.createElement;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Queue behaviour with real threads:
 * - Strict submission order, one job at a time
 * - Backpressure when the queue is full
 * - Hard timeout with a cooperative stop
 */
class JobQueueTest {

    private ExecutorService workers;
    private ExecutorService pipelines;
    private InMemoryJobRepository repository;
    private List<Job> finished;

    @BeforeEach
    void setUp() {
        workers = Executors.newCachedThreadPool();
        pipelines = Executors.newCachedThreadPool();
        repository = new InMemoryJobRepository(Clock.systemUTC());
        finished = new CopyOnWriteArrayList<>();
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
        pipelines.shutdownNow();
    }

    private JobQueue queue(JobRunner runner, int maxQueued, Duration timeout) {
        return new JobQueue(runner, repository, new JobListener() {
            @Override
            public void jobFinished(Job job) {
                finished.add(job);
            }
        }, Clock.systemUTC(), maxQueued, timeout, workers, pipelines);
    }

    private static Job job(String id) {
        return new Job(id, Batch.of(List.of(createElement(null, "node", id))), Instant.now(), null);
    }

    private static ExecutionReport done() {
        return new ExecutionReport(List.of(), null, 0, 0, null, false);
    }

    @Test
    void runsJobsOneAtATimeInSubmissionOrder() throws Exception {
        List<String> order = new CopyOnWriteArrayList<>();
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        JobQueue queue = queue((job, stop) -> {
            maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            order.add(job.id());
            active.decrementAndGet();
            return done();
        }, 100, Duration.ofSeconds(10));

        for (int i = 0; i < 5; i++) {
            assertThat(queue.enqueue(job("job-" + i)).isOk()).isTrue();
        }
        Poll.until(() -> finished.size() == 5, Duration.ofSeconds(10));

        assertThat(order).containsExactly("job-0", "job-1", "job-2", "job-3", "job-4");
        assertThat(maxActive).hasValue(1);
        assertThat(finished).allMatch(job -> job.status() == JobStatus.COMPLETE);
        Poll.until(() -> !queue.isRunning(), Duration.ofSeconds(5));
    }

    @Test
    void rejectsWhenQueueIsFull() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        JobQueue queue = queue((job, stop) -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return done();
        }, 1, Duration.ofSeconds(30));

        Job running = job("running");
        queue.enqueue(running);
        Poll.until(() -> running.status() == JobStatus.PROCESSING, Duration.ofSeconds(5));
        Result<Job> waiting = queue.enqueue(job("waiting"));
        Result<Job> rejected = queue.enqueue(job("rejected"));

        assertThat(waiting.isOk()).isTrue();
        assertThat(rejected.isOk()).isFalse();
        assertThat(rejected.error().code()).isEqualTo(ErrorCode.QUEUE_FULL);
        assertThat(queue.queuedCount()).isEqualTo(1);
        assertThat(repository.findById("rejected")).isEmpty();

        release.countDown();
        Poll.until(() -> finished.size() == 2, Duration.ofSeconds(10));
    }

    @Test
    void timeoutStopsTheRunAtTheNextBoundary() throws Exception {
        AtomicInteger boundaries = new AtomicInteger();
        JobQueue queue = queue((job, stop) -> {
            while (!stop.getAsBoolean()) {
                boundaries.incrementAndGet();
                try {
                    Thread.sleep(10);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
            return new ExecutionReport(List.of(), null, 10, 3, null, true);
        }, 10, Duration.ofMillis(200));

        Job slow = job("slow");
        queue.enqueue(slow);
        Poll.until(() -> finished.size() == 1, Duration.ofSeconds(10));

        assertThat(slow.status()).isEqualTo(JobStatus.ERROR);
        assertThat(slow.error().code()).isEqualTo(ErrorCode.TIMEOUT);
        assertThat(slow.digest().integrityFlags().hadTimeout()).isTrue();
        assertThat(boundaries.get()).isPositive();
    }

    @Test
    void runnerFailureBecomesInternalError() throws Exception {
        JobQueue queue = queue((job, stop) -> {
            throw new IllegalStateException("substrate exploded");
        }, 10, Duration.ofSeconds(5));

        Job job = job("boom");
        queue.enqueue(job);
        Poll.until(() -> finished.size() == 1, Duration.ofSeconds(5));

        assertThat(job.status()).isEqualTo(JobStatus.ERROR);
        assertThat(job.error().code()).isEqualTo(ErrorCode.INTERNAL_ERROR);
        assertThat(job.error().message()).contains("substrate exploded");
    }

    @Test
    void drainedJobsAreReturnedInOrder() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        JobQueue queue = queue((job, stop) -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return done();
        }, 10, Duration.ofSeconds(30));

        Job first = job("first");
        queue.enqueue(first);
        Poll.until(() -> first.status() == JobStatus.PROCESSING, Duration.ofSeconds(5));
        queue.enqueue(job("second"));
        queue.enqueue(job("third"));

        assertThat(queue.drainQueued()).extracting(Job::id).containsExactly("second", "third");
        assertThat(queue.queuedCount()).isZero();
        release.countDown();
    }
}
