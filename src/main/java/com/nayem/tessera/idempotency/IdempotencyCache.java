package com.nayem.tessera.idempotency;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Process-wide store of idempotency keys.
 * <p>
 * A key is reserved when a request first arrives and becomes a stored result
 * when its job completes. Records of failed jobs are released so the client
 * can resubmit under the same key. Completed records expire {@code ttl} after
 * completion; the oldest are dropped once {@code maxRecords} is reached.
 * </p>
 * <p>
 * Time comes from the injected {@link Clock}, for the expiry check and for
 * Caffeine's ticker alike.
 * </p>
 *
 * @param <R> type of the result stored for completed jobs
 */
public class IdempotencyCache<R> {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofHours(24);
    public static final long DEFAULT_MAX_RECORDS = 10_000;

    private final Clock clock;
    private final Duration ttl;
    private final Cache<String, IdempotencyRecord<R>> records;

    public IdempotencyCache(Clock clock) {
        this(clock, DEFAULT_TTL, DEFAULT_MAX_RECORDS);
    }

    public IdempotencyCache(Clock clock, Duration ttl, long maxRecords) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        this.clock = clock;
        this.ttl = ttl;
        Ticker ticker = () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
        this.records = Caffeine.newBuilder()
                .maximumSize(maxRecords)
                .expireAfter(new RecordExpiry<R>(clock))
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    /**
     * Atomically looks up {@code key} and reserves it for {@code jobId} if it is
     * unused or expired.
     */
    public synchronized Reservation<R> reserve(String key, String fingerprint, String jobId) {
        Optional<IdempotencyRecord<R>> existing = find(key);
        if (existing.isEmpty()) {
            IdempotencyRecord<R> record = IdempotencyRecord.reserved(key, fingerprint, jobId, clock.instant());
            records.put(key, record);
            return new Reservation.Fresh<>(record);
        }
        IdempotencyRecord<R> record = existing.get();
        if (record.fingerprint().equals(fingerprint)) {
            log.debug("Idempotency key '{}' replays job {}", key, record.jobId());
            return new Reservation.Replay<>(record);
        }
        log.debug("Idempotency key '{}' reused with a different payload (owned by job {})", key, record.jobId());
        return new Reservation.Conflict<>(record);
    }

    /**
     * Turns the reservation held by {@code jobId} into a stored result, expiring
     * {@code ttl} from now.
     */
    public synchronized Optional<IdempotencyRecord<R>> complete(String key, String jobId, R result) {
        IdempotencyRecord<R> record = records.getIfPresent(key);
        if (record == null || !record.jobId().equals(jobId)) {
            log.warn("Idempotency key '{}' is no longer reserved for job {}", key, jobId);
            return Optional.empty();
        }
        IdempotencyRecord<R> completed = record.completed(clock.instant().plus(ttl), result);
        records.put(key, completed);
        return Optional.of(completed);
    }

    /**
     * Drops a reservation whose job failed. Completed records and records owned
     * by other jobs are left alone.
     */
    public synchronized void release(String key, String jobId) {
        IdempotencyRecord<R> record = records.getIfPresent(key);
        if (record != null && record.jobId().equals(jobId) && !record.isCompleted()) {
            records.invalidate(key);
        }
    }

    /**
     * Live record for {@code key}. Expired records are treated as absent and
     * removed.
     */
    public Optional<IdempotencyRecord<R>> find(String key) {
        IdempotencyRecord<R> record = records.getIfPresent(key);
        if (record == null) {
            return Optional.empty();
        }
        if (record.isExpired(clock.instant())) {
            records.asMap().remove(key, record);
            return Optional.empty();
        }
        return Optional.of(record);
    }

    /**
     * Removes every expired record.
     *
     * @return number of records removed
     */
    public synchronized int purgeExpired() {
        Instant now = clock.instant();
        int before = records.asMap().size();
        records.asMap().values().removeIf(record -> record.isExpired(now));
        records.cleanUp();
        int removed = before - records.asMap().size();
        if (removed > 0) {
            log.debug("Purged {} expired idempotency record(s)", removed);
        }
        return removed;
    }

    public Duration ttl() {
        return ttl;
    }

    public long size() {
        return records.estimatedSize();
    }

    /**
     * Clears all records. Useful for testing.
     */
    public void clear() {
        records.invalidateAll();
    }

    /**
     * Reservations never expire; completed records expire at their
     * {@code expiresAt}.
     */
    private static final class RecordExpiry<R> implements Expiry<String, IdempotencyRecord<R>> {

        private final Clock clock;

        private RecordExpiry(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long expireAfterCreate(String key, IdempotencyRecord<R> record, long currentTime) {
            return remaining(record);
        }

        @Override
        public long expireAfterUpdate(String key, IdempotencyRecord<R> record, long currentTime,
                long currentDuration) {
            return remaining(record);
        }

        @Override
        public long expireAfterRead(String key, IdempotencyRecord<R> record, long currentTime,
                long currentDuration) {
            return currentDuration;
        }

        private long remaining(IdempotencyRecord<R> record) {
            if (!record.isCompleted()) {
                return Long.MAX_VALUE;
            }
            // One millisecond past expiresAt, so the record is still served at exactly expiresAt.
            Duration remaining = Duration.between(clock.instant(), record.expiresAt()).plusMillis(1);
            return remaining.isNegative() ? 0 : remaining.toNanos();
        }
    }
}
