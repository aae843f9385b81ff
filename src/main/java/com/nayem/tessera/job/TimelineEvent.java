package com.nayem.tessera.job;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Entry in a job's timeline.
 *
 * @param event   {@code queued}, {@code processing}, {@code chunk-committed},
 *                {@code complete} or {@code failed}
 * @param at      when it happened
 * @param details event-specific values, e.g. chunk index and count
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record TimelineEvent(String event, Instant at, Map<String, Object> details) {

    public static final String QUEUED = "queued";
    public static final String PROCESSING = "processing";
    public static final String CHUNK_COMMITTED = "chunk-committed";
    public static final String COMPLETE = "complete";
    public static final String FAILED = "failed";

    public TimelineEvent {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static TimelineEvent of(String event, Instant at) {
        return new TimelineEvent(event, at, Map.of());
    }
}
