package com.example.particlesync.handler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands connection events off from transport threads to serial per-room lanes.
 * A room always maps to the same lane, so its events are applied one at a time in arrival order;
 * rooms on different lanes are processed in parallel. Each lane must run tasks sequentially.
 */
public class RoomEventDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RoomEventDispatcher.class);

    private final ConnectionEventProcessor processor;
    private final List<? extends Executor> lanes;

    public RoomEventDispatcher(ConnectionEventProcessor processor, List<? extends Executor> lanes) {
        this.processor = Objects.requireNonNull(processor, "processor");
        if (lanes == null || lanes.isEmpty()) throw new IllegalArgumentException("at least one lane required");
        this.lanes = List.copyOf(lanes);
    }

    /** One single-threaded executor per lane, with named daemon threads. */
    public static RoomEventDispatcher withLanes(ConnectionEventProcessor processor, int count) {
        if (count < 1) throw new IllegalArgumentException("lane count must be positive: " + count);
        AtomicInteger c = new AtomicInteger();
        ExecutorService[] executors = new ExecutorService[count];
        for (int i = 0; i < count; i++) {
            executors[i] = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "room-lane-" + c.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        }
        return new RoomEventDispatcher(processor, List.of(executors));
    }

    public void dispatch(ConnectionEvent event) {
        Executor lane = laneFor(event.roomId());
        try {
            lane.execute(() -> {
                try {
                    processor.apply(event);
                } catch (Throwable t) {
                    log.error("Event {} failed (room={}, user={})",
                            event.getClass().getSimpleName(), event.roomId(), event.userId(), t);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Event {} rejected (room={}, user={}): dispatcher is shut down",
                    event.getClass().getSimpleName(), event.roomId(), event.userId());
        }
    }

    Executor laneFor(String roomId) {
        return lanes.get(Math.floorMod(roomId.hashCode(), lanes.size()));
    }

    @Override
    public void close() {
        for (Executor lane : lanes) {
            if (lane instanceof ExecutorService es) {
                es.shutdown();
                try {
                    if (!es.awaitTermination(2, TimeUnit.SECONDS)) es.shutdownNow();
                } catch (InterruptedException e) {
                    es.shutdownNow();
                    Thread.currentThread().interrupt();
                }
            }
        }
    }
}
