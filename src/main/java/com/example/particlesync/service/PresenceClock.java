package com.example.particlesync.service;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Two readings of time for the presence core.
 * <ul>
 *   <li>{@link #timestamp()}: epoch millis put on the wire, never lower than one handed out before,
 *       even if the wall clock is stepped back.</li>
 *   <li>{@link #ticks()}: monotonic millis for liveness and idle ages; only differences are meaningful,
 *       so wall clock steps never expire a client or a room.</li>
 * </ul>
 */
public class PresenceClock {

    private final Clock wall;
    private final LongSupplier monotonicMillis;
    private final AtomicLong lastIssued = new AtomicLong(Long.MIN_VALUE);

    public PresenceClock(Clock wall, LongSupplier monotonicMillis) {
        this.wall = Objects.requireNonNull(wall, "wall");
        this.monotonicMillis = Objects.requireNonNull(monotonicMillis, "monotonicMillis");
    }

    public static PresenceClock system() {
        return new PresenceClock(Clock.systemUTC(), () -> System.nanoTime() / 1_000_000L);
    }

    public long timestamp() {
        return lastIssued.accumulateAndGet(wall.millis(), Math::max);
    }

    public long ticks() {
        return monotonicMillis.getAsLong();
    }
}
