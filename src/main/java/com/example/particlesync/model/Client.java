package com.example.particlesync.model;

import com.example.particlesync.connection.ConnectionHandle;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * One joined user of a room: the owned connection, liveness timestamp and last-known presentation state.
 * Mutated only by {@code RoomRegistry} while holding the owning {@link Room}'s monitor.
 */
public class Client {

    /** White, used until the user reports a color. */
    public static final long DEFAULT_COLOR = 0xFFFFFFL;

    private final String roomId;
    private final String userId;
    private final ConnectionHandle connection;
    private final long joinedAt;

    private volatile long lastSeen;     // monotonic ticks of last inbound traffic
    private volatile long lastUpdate;   // wire timestamp of last presentation update
    private long color = DEFAULT_COLOR;
    private JsonNode particles;         // opaque pass-through

    public Client(String roomId, String userId, ConnectionHandle connection, long joinedAt, long tick) {
        this.roomId = Objects.requireNonNull(roomId, "roomId");
        this.userId = Objects.requireNonNull(userId, "userId");
        this.connection = Objects.requireNonNull(connection, "connection");
        this.joinedAt = joinedAt;
        this.lastSeen = tick;
        this.lastUpdate = joinedAt;
    }

    public String getRoomId() { return roomId; }
    public String getUserId() { return userId; }
    public ConnectionHandle getConnection() { return connection; }
    public long getJoinedAt() { return joinedAt; }

    // liveness
    public long getLastSeen() { return lastSeen; }
    public void markSeen(long tick) { this.lastSeen = tick; }

    /** True if nothing was heard from this client for longer than {@code timeoutMs}. */
    public boolean isExpired(long tick, long timeoutMs) {
        return tick - lastSeen > timeoutMs;
    }

    // presentation
    public long getColor() { return color; }
    public JsonNode getParticles() { return particles; }
    public long getLastUpdate() { return lastUpdate; }

    /** A missing color keeps the previous one; particles are replaced as sent. */
    public void applyUpdate(JsonNode particles, Long color, long timestamp, long tick) {
        this.particles = particles;
        if (color != null) this.color = color;
        this.lastUpdate = timestamp;
        this.lastSeen = tick;
    }

    public boolean owns(ConnectionHandle candidate) {
        return connection == candidate;
    }

    @Override
    public String toString() {
        return "Client{" +
                "roomId='" + roomId + '\'' +
                ", userId='" + userId + '\'' +
                ", connection=" + connection.id() +
                ", lastSeen=" + lastSeen +
                ", color=" + color +
                '}';
    }
}
