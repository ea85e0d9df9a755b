package com.example.particlesync.service;

import com.example.particlesync.config.PresenceProperties;
import com.example.particlesync.model.Client;
import com.example.particlesync.model.Room;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Backstop that drops whole rooms without recent activity, members included.
 * Members are not notified; their connections are closed.
 */
@Component
public class IdleRoomReaper {

    private static final Logger log = LoggerFactory.getLogger(IdleRoomReaper.class);

    private final RoomRegistry registry;
    private final long roomIdleTimeoutMs;

    public IdleRoomReaper(RoomRegistry registry, PresenceProperties properties) {
        this.registry = registry;
        this.roomIdleTimeoutMs = properties.roomIdleTimeout().toMillis();
    }

    /** @return number of rooms removed */
    public int reapIdleRooms() {
        long now = registry.ticks();
        int reaped = 0;
        for (Room room : registry.rooms()) {
            Optional<List<Client>> residual =
                    registry.removeRoomIf(room.getRoomId(), r -> r == room && r.isIdle(now, roomIdleTimeoutMs));
            if (residual.isEmpty()) continue;

            reaped++;
            List<Client> clients = residual.get();
            clients.forEach(c -> c.getConnection().close());
            log.info("Cleaned inactive room {} (idle for {} ms, {} residual client(s))",
                    room.getRoomId(), room.idleMillis(now), clients.size());
        }
        return reaped;
    }
}
