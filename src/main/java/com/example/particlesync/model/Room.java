package com.example.particlesync.model;

import java.util.*;

/**
 * Room model: members keyed by userId plus the activity timestamps used by the sweeps.
 * RoomRegistry synchronizes on Room instances, so this class itself does not add extra locking.
 */
public class Room {

    private final String roomId;
    private final long createdAt;   // wire timestamp

    /** Members by userId (insertion order preserved for listings). */
    private final Map<String, Client> members = new LinkedHashMap<>();

    // monotonic ticks
    private volatile long lastActivity;
    private volatile long lastCleanup;

    /** Set once the room has been dropped from the registry; a retired room never takes new members. */
    private volatile boolean retired;

    public Room(String roomId, long createdAt, long tick) {
        this.roomId = Objects.requireNonNull(roomId, "roomId");
        this.createdAt = createdAt;
        this.lastActivity = tick;
        this.lastCleanup = tick;
    }

    public String getRoomId() { return roomId; }
    public long getCreatedAt() { return createdAt; }

    // ---------------------------------------------------------------------
    // Members
    // ---------------------------------------------------------------------

    public Client getMember(String userId) {
        if (userId == null) return null;
        return members.get(userId);
    }

    /** Snapshot of the members, in join order. */
    public List<Client> getMembers() {
        return new ArrayList<>(members.values());
    }

    public List<String> getMemberIds() {
        return new ArrayList<>(members.keySet());
    }

    public int size() { return members.size(); }

    public boolean isEmpty() { return members.isEmpty(); }

    /** Inserts the client, returning whichever client it displaced (if any). */
    public Client putMember(Client client) {
        return members.put(client.getUserId(), client);
    }

    public Client removeMember(String userId) {
        if (userId == null) return null;
        return members.remove(userId);
    }

    /** Removes and returns every member. */
    public List<Client> drainMembers() {
        List<Client> out = new ArrayList<>(members.values());
        members.clear();
        return out;
    }

    // ---------------------------------------------------------------------
    // Activity
    // ---------------------------------------------------------------------

    public void markActivity(long tick) { this.lastActivity = tick; }

    public long getLastCleanup() { return lastCleanup; }
    public void markCleanup(long tick) { this.lastCleanup = tick; }

    public long idleMillis(long tick) {
        return tick - lastActivity;
    }

    public boolean isIdle(long tick, long idleTimeoutMs) {
        return idleMillis(tick) > idleTimeoutMs;
    }

    public boolean isRetired() { return retired; }
    public void retire() { this.retired = true; }

    @Override
    public String toString() {
        return "Room{" +
                "roomId='" + roomId + '\'' +
                ", members=" + members.keySet() +
                ", lastActivity=" + lastActivity +
                ", retired=" + retired +
                '}';
    }
}
