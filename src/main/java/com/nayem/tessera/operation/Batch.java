package com.nayem.tessera.operation;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Request envelope: an ordered list of operations plus request-level options.
 *
 * @param changes           operations in execution order
 * @param duplicateStrategy batch default, overridden per operation by
 *                          {@link Operation#onDuplicate()}
 * @param idempotencyKey    optional client key for safe retries
 * @param granularity       optional chunking mode
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Batch(
        List<Operation> changes,
        DuplicateStrategy duplicateStrategy,
        String idempotencyKey,
        ExecutionGranularity granularity) {

    public static Batch of(List<Operation> changes) {
        return new Batch(changes, null, null, null);
    }

    public Batch withIdempotencyKey(String key) {
        return new Batch(changes, duplicateStrategy, key, granularity);
    }

    public Batch withDuplicateStrategy(DuplicateStrategy strategy) {
        return new Batch(changes, strategy, idempotencyKey, granularity);
    }

    public Batch withGranularity(ExecutionGranularity mode) {
        return new Batch(changes, duplicateStrategy, idempotencyKey, mode);
    }

    public int size() {
        return changes == null ? 0 : changes.size();
    }

    /**
     * The payload that idempotency fingerprints are computed over: no key, and
     * an absent duplicate strategy spelled out as {@code error}.
     */
    public Batch normalizedForFingerprint() {
        return new Batch(changes, duplicateStrategy == null ? DuplicateStrategy.ERROR : duplicateStrategy, null,
                granularity);
    }
}
