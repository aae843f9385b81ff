package com.nayem.tessera.support;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Sleeps in small steps until a condition holds.
 */
public final class Poll {

    private Poll() {
    }

    public static void until(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within " + timeout.toMillis() + "ms");
            }
            Thread.sleep(10);
        }
    }
}
