package com.nayem.tessera.job;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * One line of a job listing.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobSummary(
        String operationId,
        JobStatus status,
        int requested,
        int executed,
        int skipped,
        Instant submittedAt,
        Instant startedAt,
        Instant completedAt,
        Long durationMs) {
}
