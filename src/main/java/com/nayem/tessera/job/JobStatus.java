package com.nayem.tessera.job;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Lifecycle of a submitted batch. Transitions only move forward:
 * {@code queued -> processing -> complete | error}, with {@code queued -> error}
 * for jobs that never start.
 */
public enum JobStatus {

    /**
     * Accepted and waiting for the writer.
     */
    QUEUED,

    /**
     * The pipeline is running it.
     */
    PROCESSING,

    /**
     * Every chunk committed. Individual operations may still be skipped.
     */
    COMPLETE,

    /**
     * Ended early: rejected before execution, rolled back, timed out or stopped.
     */
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }

    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case QUEUED -> next == PROCESSING || next == ERROR;
            case PROCESSING -> next == COMPLETE || next == ERROR;
            case COMPLETE, ERROR -> false;
        };
    }

    public static Optional<JobStatus> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (JobStatus status : values()) {
            if (status.name().equalsIgnoreCase(value.trim())) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
