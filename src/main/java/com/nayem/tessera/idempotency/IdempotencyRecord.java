package com.nayem.tessera.idempotency;

import java.time.Instant;

/**
 * Idempotency key bound to the payload and job it was first used with.
 *
 * @param key         client key
 * @param fingerprint payload fingerprint
 * @param jobId       job that owns the key
 * @param firstSeenAt when the key was first reserved
 * @param expiresAt   end of the replay window; null while the job is running
 * @param result      stored terminal result; null while the job is running
 * @param <R>         type of the stored result
 */
public record IdempotencyRecord<R>(
        String key,
        String fingerprint,
        String jobId,
        Instant firstSeenAt,
        Instant expiresAt,
        R result) {

    public static <R> IdempotencyRecord<R> reserved(String key, String fingerprint, String jobId, Instant now) {
        return new IdempotencyRecord<>(key, fingerprint, jobId, now, null, null);
    }

    public IdempotencyRecord<R> completed(Instant expiresAt, R result) {
        return new IdempotencyRecord<>(key, fingerprint, jobId, firstSeenAt, expiresAt, result);
    }

    /**
     * Whether the owning job completed and the record is now a stored result.
     */
    public boolean isCompleted() {
        return expiresAt != null;
    }

    /**
     * Expired once {@code now} is strictly after {@code expiresAt}.
     */
    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }
}
