package com.nayem.tessera.idempotency;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Idempotency block attached to submit and poll responses.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IdempotencyMeta(String key, boolean replayed, Instant firstSeenAt, Instant expiresAt) {

    public static IdempotencyMeta of(IdempotencyRecord<?> record, boolean replayed) {
        return new IdempotencyMeta(record.key(), replayed, record.firstSeenAt(), record.expiresAt());
    }
}
