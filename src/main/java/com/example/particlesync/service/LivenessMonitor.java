package com.example.particlesync.service;

import com.example.particlesync.config.PresenceProperties;
import com.example.particlesync.model.Client;
import com.example.particlesync.model.Room;
import com.example.particlesync.protocol.ServerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Heartbeat probes and the inactive-client sweep.
 * Liveness is derived from {@link Client#getLastSeen()} alone, measured in monotonic ticks.
 * Both operations are single synchronous steps, scheduled by {@link PresenceScheduler}.
 */
@Component
public class LivenessMonitor {

    private static final Logger log = LoggerFactory.getLogger(LivenessMonitor.class);

    private final RoomRegistry registry;
    private final BroadcastRouter router;
    private final long clientTimeoutMs;
    private final long cleanupIntervalMs;

    public LivenessMonitor(RoomRegistry registry, BroadcastRouter router, PresenceProperties properties) {
        this.registry = registry;
        this.router = router;
        this.clientTimeoutMs = properties.clientTimeout().toMillis();
        this.cleanupIntervalMs = properties.cleanupInterval().toMillis();
    }

    /**
     * Pings every client of every room. A closed connection or a failed send counts as a disconnect.
     *
     * @return number of clients removed
     */
    public int sendHeartbeats() {
        int removed = 0;
        for (Room room : registry.rooms()) {
            synchronized (room) {
                if (room.isRetired()) continue;
                ServerMessage ping = ServerMessage.Ping.at(registry.timestamp());
                for (Client client : room.getMembers()) {
                    // an earlier eviction in this loop may already have dropped it
                    if (room.getMember(client.getUserId()) != client) continue;
                    if (!router.sendTo(client, ping)) {
                        log.warn("Heartbeat to user {} in room {} failed, removing", client.getUserId(), room.getRoomId());
                        registry.evict(room, client, "heartbeat failed");
                        removed++;
                    }
                }
            }
        }
        return removed;
    }

    /**
     * Evicts clients that have not been heard from within the client timeout.
     * A room is examined at most once per cleanup interval.
     *
     * @return number of clients evicted
     */
    public int sweepInactiveClients() {
        int evicted = 0;
        long now = registry.ticks();
        for (Room room : registry.rooms()) {
            synchronized (room) {
                if (room.isRetired()) continue;
                if (now - room.getLastCleanup() < cleanupIntervalMs) continue;

                for (Client client : room.getMembers()) {
                    if (room.getMember(client.getUserId()) != client) continue;
                    if (client.isExpired(now, clientTimeoutMs)) {
                        log.info("Cleaning up inactive user {} in room {} (silent for {} ms)",
                                client.getUserId(), room.getRoomId(), now - client.getLastSeen());
                        registry.evict(room, client, "timeout");
                        evicted++;
                    }
                }
                room.markCleanup(now);
            }
        }
        return evicted;
    }
}
