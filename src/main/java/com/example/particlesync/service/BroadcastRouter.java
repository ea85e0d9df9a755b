package com.example.particlesync.service;

import com.example.particlesync.model.Client;
import com.example.particlesync.model.Room;
import com.example.particlesync.protocol.MessageCodec;
import com.example.particlesync.protocol.ServerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Fan-out of one message to the members of a room.
 * The message is encoded once; a failing member never stops delivery to the rest.
 * Eviction of failed members is left to the caller (see {@link RoomRegistry#broadcast}).
 */
@Component
public class BroadcastRouter {

    private static final Logger log = LoggerFactory.getLogger(BroadcastRouter.class);

    private final MessageCodec codec;

    public BroadcastRouter(MessageCodec codec) {
        this.codec = codec;
    }

    /**
     * Sends {@code message} to every open member of {@code room} except {@code excludeUserId}.
     * Caller must hold the room's monitor.
     *
     * @return members whose send failed, in room order
     */
    public List<Client> fanOut(Room room, ServerMessage message, String excludeUserId) {
        List<Client> members = room.getMembers();
        if (members.isEmpty()) return List.of();

        String frame = codec.encode(message);
        List<Client> failed = new ArrayList<>();
        int delivered = 0;
        for (Client client : members) {
            if (excludeUserId != null && excludeUserId.equals(client.getUserId())) continue;
            if (!client.getConnection().isOpen()) continue;

            if (client.getConnection().send(frame)) {
                delivered++;
            } else {
                failed.add(client);
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("Broadcast room={} type={} subject={} delivered={} failed={}",
                    room.getRoomId(), message.getClass().getSimpleName(), message.userId(), delivered, failed.size());
        }
        return failed;
    }

    /** Sends {@code message} to a single client. */
    public boolean sendTo(Client client, ServerMessage message) {
        if (!client.getConnection().isOpen()) return false;
        return client.getConnection().send(codec.encode(message));
    }
}
