package com.nayem.tessera.core;

/**
 * Job counts by status, plus the size of the idempotency cache.
 */
public record EngineStats(long queued, long processing, long complete, long error, long idempotencyRecords) {
}
