package com.nayem.tessera.model;

/**
 * What the substrate reports after a commit. A {@code committed} outcome is not
 * proof that the unit was applied: some substrates discard oversized units
 * silently, which only post-commit verification can detect.
 */
public record CommitOutcome(boolean committed, String reason) {

    public static CommitOutcome success() {
        return new CommitOutcome(true, null);
    }

    public static CommitOutcome rolledBack(String reason) {
        return new CommitOutcome(false, reason);
    }
}
