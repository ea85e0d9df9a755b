package com.example.particlesync.service;

import com.example.particlesync.model.Room;
import com.example.particlesync.protocol.ServerMessage;
import org.springframework.stereotype.Component;

/**
 * Periodic room snapshot: every member of a non-empty room receives a {@code clients} message
 * listing all members with their last presentation state. Members whose send fails are evicted.
 */
@Component
public class RosterPublisher {

    private final RoomRegistry registry;

    public RosterPublisher(RoomRegistry registry) {
        this.registry = registry;
    }

    /** @return number of rooms a snapshot was sent to */
    public int publishRosters() {
        int published = 0;
        for (Room room : registry.rooms()) {
            synchronized (room) {
                if (room.isRetired() || room.isEmpty()) continue;
                ServerMessage.Clients roster =
                        ServerMessage.Clients.at(registry.timestamp(), RoomRegistry.memberStates(room, null));
                registry.broadcastLocked(room, roster, null);
                published++;
            }
        }
        return published;
    }
}
