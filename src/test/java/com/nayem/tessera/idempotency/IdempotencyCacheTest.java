package com.nayem.tessera.idempotency;

import com.nayem.tessera.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class IdempotencyCacheTest {

    private MutableClock clock;
    private IdempotencyCache<String> cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        cache = new IdempotencyCache<>(clock);
    }

    @Test
    void firstUseReservesTheKey() {
        Reservation<String> reservation = cache.reserve("k1", "fp", "job-1");

        assertThat(reservation).isInstanceOf(Reservation.Fresh.class);
        assertThat(reservation.record().jobId()).isEqualTo("job-1");
        assertThat(reservation.record().isCompleted()).isFalse();
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void samePayloadWhileRunningReplaysWithoutResult() {
        cache.reserve("k1", "fp", "job-1");

        Reservation<String> again = cache.reserve("k1", "fp", "job-2");

        assertThat(again).isInstanceOf(Reservation.Replay.class);
        assertThat(again.record().jobId()).isEqualTo("job-1");
        assertThat(again.record().result()).isNull();
    }

    @Test
    void differentPayloadConflicts() {
        cache.reserve("k1", "fp", "job-1");

        Reservation<String> other = cache.reserve("k1", "other", "job-2");

        assertThat(other).isInstanceOf(Reservation.Conflict.class);
        assertThat(other.record().jobId()).isEqualTo("job-1");
    }

    @Test
    void completedResultIsReplayedUntilTtlElapses() {
        cache.reserve("k1", "fp", "job-1");
        clock.advance(Duration.ofMinutes(5));
        IdempotencyRecord<String> completed = cache.complete("k1", "job-1", "result").orElseThrow();
        assertThat(completed.expiresAt()).isEqualTo(Instant.parse("2026-03-02T10:05:00Z"));

        clock.advance(Duration.ofHours(23).plusMinutes(59));
        Reservation<String> replay = cache.reserve("k1", "fp", "job-2");
        assertThat(replay).isInstanceOf(Reservation.Replay.class);
        assertThat(replay.record().result()).isEqualTo("result");

        clock.advance(Duration.ofMinutes(2));
        Reservation<String> fresh = cache.reserve("k1", "fp", "job-3");
        assertThat(fresh).isInstanceOf(Reservation.Fresh.class);
        assertThat(fresh.record().jobId()).isEqualTo("job-3");
    }

    @Test
    void recordIsStillServedAtExactlyItsExpiry() {
        cache.reserve("k1", "fp", "job-1");
        IdempotencyRecord<String> completed = cache.complete("k1", "job-1", "result").orElseThrow();

        clock.set(completed.expiresAt());

        assertThat(cache.find("k1")).isPresent();
        clock.advance(Duration.ofMillis(1));
        assertThat(cache.find("k1")).isEmpty();
    }

    @Test
    void releasedKeyCanBeReused() {
        cache.reserve("k1", "fp", "job-1");

        cache.release("k1", "job-1");

        assertThat(cache.reserve("k1", "other", "job-2")).isInstanceOf(Reservation.Fresh.class);
    }

    @Test
    void releaseLeavesCompletedAndForeignRecordsAlone() {
        cache.reserve("k1", "fp", "job-1");
        cache.complete("k1", "job-1", "done");
        cache.reserve("k2", "fp", "job-2");

        cache.release("k1", "job-1");
        cache.release("k2", "job-9");

        assertThat(cache.find("k1")).isPresent();
        assertThat(cache.find("k2")).isPresent();
    }

    @Test
    void completeRequiresTheOwningJob() {
        cache.reserve("k1", "fp", "job-1");

        assertThat(cache.complete("k1", "job-2", "result")).isEmpty();
        assertThat(cache.complete("missing", "job-1", "result")).isEmpty();
    }

    @Test
    void purgeRemovesOnlyExpiredRecords() {
        cache = new IdempotencyCache<>(clock, Duration.ofHours(1), 100);
        cache.reserve("old", "fp", "job-1");
        cache.complete("old", "job-1", "r1");
        clock.advance(Duration.ofMinutes(30));
        cache.reserve("new", "fp", "job-2");
        cache.complete("new", "job-2", "r2");
        cache.reserve("running", "fp", "job-3");

        clock.advance(Duration.ofMinutes(45));
        cache.purgeExpired();

        assertThat(cache.find("old")).isEmpty();
        assertThat(cache.find("new")).isPresent();
        assertThat(cache.find("running")).isPresent();
    }
}
