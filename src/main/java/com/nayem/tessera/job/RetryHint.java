package com.nayem.tessera.job;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.nayem.tessera.error.EngineError;

import java.util.List;

/**
 * Suggestion for resubmitting a failed job.
 *
 * @param strategy short name of the suggested change
 * @param opIndex  operation the suggestion starts from, if any
 * @param message  human readable explanation
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RetryHint(String strategy, Integer opIndex, String message) {

    public static final String RESUBMIT_FROM_INDEX = "resubmit-from-index";
    public static final String PER_OPERATION = "per-operation";
    public static final String FIX_AND_RESUBMIT = "fix-and-resubmit";
    public static final String USE_REUSE_STRATEGY = "use-reuse-strategy";
    public static final String NEW_IDEMPOTENCY_KEY = "new-idempotency-key";
    public static final String RESUBMIT = "resubmit";

    /**
     * Hints for a job that ended with {@code error}.
     */
    public static List<RetryHint> forError(EngineError error) {
        if (error == null) {
            return List.of();
        }
        return switch (error.code()) {
            case CHUNK_ROLLBACK -> List.of(
                    new RetryHint(RESUBMIT_FROM_INDEX, error.opIndex(),
                            "Operations before " + error.opIndex() + " are committed; resubmit the rest"),
                    new RetryHint(PER_OPERATION, error.opIndex(),
                            "Resubmit with granularity per-operation to limit each commit to one operation"));
            case DUPLICATE_CONFLICT -> List.of(new RetryHint(USE_REUSE_STRATEGY, error.opIndex(),
                    "Set onDuplicate to 'reuse' or 'rename' for this operation"));
            case IDEMPOTENCY_CONFLICT -> List.of(new RetryHint(NEW_IDEMPOTENCY_KEY, null,
                    "Use a new idempotency key for a different payload"));
            case TIMEOUT -> List.of(new RetryHint(RESUBMIT_FROM_INDEX, error.opIndex(),
                    "Committed chunks stay committed; resubmit the unexecuted operations in a smaller batch"));
            case ENGINE_STOPPED, QUEUE_FULL, INTERNAL_ERROR -> List.of(new RetryHint(RESUBMIT, null,
                    "Nothing from this job was applied after the failure; resubmit when the engine is available"));
            default -> List.of(new RetryHint(FIX_AND_RESUBMIT, error.opIndex(),
                    error.hint() != null ? error.hint() : "Fix the reported operation and resubmit the batch"));
        };
    }
}
