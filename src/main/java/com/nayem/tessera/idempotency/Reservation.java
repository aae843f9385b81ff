package com.nayem.tessera.idempotency;

/**
 * Outcome of reserving an idempotency key at ingress.
 *
 * @param <R> type of the stored result
 */
public sealed interface Reservation<R> permits Reservation.Fresh, Reservation.Replay, Reservation.Conflict {

    IdempotencyRecord<R> record();

    /**
     * The key was unused; the candidate job now owns it.
     */
    record Fresh<R>(IdempotencyRecord<R> record) implements Reservation<R> {
    }

    /**
     * Same key and payload as an earlier request; its job answers this one.
     */
    record Replay<R>(IdempotencyRecord<R> record) implements Reservation<R> {
    }

    /**
     * Same key, different payload. Nothing may run.
     */
    record Conflict<R>(IdempotencyRecord<R> record) implements Reservation<R> {
    }
}
