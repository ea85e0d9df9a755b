package com.example.particlesync.handler;

import com.example.particlesync.connection.ConnectionHandle;
import com.example.particlesync.protocol.ClientMessage;

import java.util.Objects;

/** What the transport observed on one connection, already attributed to (room, user). */
public sealed interface ConnectionEvent
        permits ConnectionEvent.Connected, ConnectionEvent.Received, ConnectionEvent.Disconnected {

    String roomId();

    String userId();

    ConnectionHandle connection();

    record Connected(String roomId, String userId, ConnectionHandle connection) implements ConnectionEvent {
        public Connected {
            Objects.requireNonNull(roomId, "roomId");
            Objects.requireNonNull(userId, "userId");
            Objects.requireNonNull(connection, "connection");
        }
    }

    record Received(String roomId, String userId, ConnectionHandle connection, ClientMessage message)
            implements ConnectionEvent {
        public Received {
            Objects.requireNonNull(roomId, "roomId");
            Objects.requireNonNull(userId, "userId");
            Objects.requireNonNull(connection, "connection");
            Objects.requireNonNull(message, "message");
        }
    }

    record Disconnected(String roomId, String userId, ConnectionHandle connection) implements ConnectionEvent {
        public Disconnected {
            Objects.requireNonNull(roomId, "roomId");
            Objects.requireNonNull(userId, "userId");
            Objects.requireNonNull(connection, "connection");
        }
    }
}
