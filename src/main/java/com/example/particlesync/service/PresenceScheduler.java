package com.example.particlesync.service;

import com.example.particlesync.config.PresenceProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntSupplier;

/** Runs the heartbeat, the inactive-client sweep, the room snapshot and the idle-room reaper at fixed rates. */
@Component
public class PresenceScheduler {

    private static final Logger log = LoggerFactory.getLogger(PresenceScheduler.class);

    private final LivenessMonitor livenessMonitor;
    private final IdleRoomReaper reaper;
    private final RosterPublisher rosterPublisher;
    private final PresenceProperties properties;

    private final ScheduledExecutorService scheduler;

    public PresenceScheduler(LivenessMonitor livenessMonitor, IdleRoomReaper reaper,
                             RosterPublisher rosterPublisher, PresenceProperties properties) {
        this.livenessMonitor = livenessMonitor;
        this.reaper = reaper;
        this.rosterPublisher = rosterPublisher;
        this.properties = properties;
        this.scheduler = Executors.newScheduledThreadPool(2, new ThreadFactory() {
            private final AtomicInteger c = new AtomicInteger();
            @Override public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "presence-" + c.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        });
    }

    @PostConstruct
    public void start() {
        schedule("heartbeat", properties.heartbeatInterval(), livenessMonitor::sendHeartbeats);
        schedule("client-sweep", properties.cleanupInterval(), livenessMonitor::sweepInactiveClients);
        schedule("room-reaper", properties.reaperInterval(), reaper::reapIdleRooms);
        if (!properties.rosterInterval().isZero()) {
            schedule("room-roster", properties.rosterInterval(), rosterPublisher::publishRosters);
        }
        log.info("Presence scheduler started (heartbeat={}, cleanup={}, clientTimeout={}, reaper={}, roomIdle={}, roster={})",
                properties.heartbeatInterval(), properties.cleanupInterval(), properties.clientTimeout(),
                properties.reaperInterval(), properties.roomIdleTimeout(), properties.rosterInterval());
    }

    private void schedule(String name, Duration interval, IntSupplier task) {
        long periodMs = interval.toMillis();
        scheduler.scheduleAtFixedRate(() -> {
            // an escaping exception would silently cancel all further runs
            try {
                int affected = task.getAsInt();
                if (affected > 0) log.debug("{} affected {}", name, affected);
            } catch (Throwable t) {
                log.error("{} run failed", name, t);
            }
        }, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }
}
