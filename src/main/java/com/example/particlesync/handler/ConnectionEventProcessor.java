package com.example.particlesync.handler;

import com.example.particlesync.protocol.ClientMessage;
import com.example.particlesync.service.RoomRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Applies connection events to the room registry. */
@Component
public class ConnectionEventProcessor {

    private static final Logger log = LoggerFactory.getLogger(ConnectionEventProcessor.class);

    private final RoomRegistry registry;

    public ConnectionEventProcessor(RoomRegistry registry) {
        this.registry = registry;
    }

    public void apply(ConnectionEvent event) {
        if (event instanceof ConnectionEvent.Connected c) {
            registry.join(c.roomId(), c.userId(), c.connection());
        } else if (event instanceof ConnectionEvent.Received r) {
            receive(r);
        } else if (event instanceof ConnectionEvent.Disconnected d) {
            registry.disconnect(d.roomId(), d.userId(), d.connection());
        }
    }

    private void receive(ConnectionEvent.Received r) {
        ClientMessage message = r.message();
        boolean applied;
        if (message instanceof ClientMessage.Update update) {
            applied = registry.recordUpdate(r.roomId(), r.userId(), update, r.connection());
        } else if (message instanceof ClientMessage.Pong) {
            applied = registry.touch(r.roomId(), r.userId(), r.connection());
        } else {
            throw new IllegalArgumentException("Unhandled message " + message.getClass().getName());
        }
        if (!applied) {
            log.debug("Dropped {} from user {} in room {}: not a current member",
                    message.getClass().getSimpleName(), r.userId(), r.roomId());
        }
    }
}
