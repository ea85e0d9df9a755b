package com.example.particlesync.service;

import com.example.particlesync.config.PresenceProperties;
import com.example.particlesync.connection.ConnectionHandle;
import com.example.particlesync.model.Client;
import com.example.particlesync.model.Room;
import com.example.particlesync.protocol.ClientMessage;
import com.example.particlesync.protocol.ServerMessage;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Room registry: which users are joined to which rooms.
 *
 * <ul>
 *   <li>Rooms are created on first join and dropped in the same step that removes their last member.</li>
 *   <li>Every mutation of a room runs while holding that room's monitor; different rooms never contend.</li>
 *   <li>A join for a userId that is already present evicts the previous session first.</li>
 *   <li>Wire timestamps come from {@link PresenceClock#timestamp()}; ages are measured in {@link PresenceClock#ticks()}.</li>
 *   <li>Leave/update/touch for unknown rooms or users are silent no-ops.</li>
 * </ul>
 */
@Service
public class RoomRegistry {

    private static final Logger log = LoggerFactory.getLogger(RoomRegistry.class);

    private final Map<String, Room> rooms = new ConcurrentHashMap<>();

    private final BroadcastRouter router;
    private final PresenceClock time;
    private final boolean sendRosterOnJoin;

    public RoomRegistry(BroadcastRouter router, PresenceClock time, PresenceProperties properties) {
        this.router = Objects.requireNonNull(router, "router");
        this.time = Objects.requireNonNull(time, "time");
        this.sendRosterOnJoin = properties.sendRosterOnJoin();
    }

    // ========================================================================
    //  ROOMS
    // ========================================================================

    public Room getOrCreate(String roomId) {
        return rooms.computeIfAbsent(roomId, id -> {
            log.info("Created room {}", id);
            return new Room(id, timestamp(), ticks());
        });
    }

    public Room find(String roomId) {
        if (roomId == null) return null;
        return rooms.get(roomId);
    }

    /** Snapshot of the registered rooms. */
    public List<Room> rooms() {
        return new ArrayList<>(rooms.values());
    }

    public int roomCount() {
        return rooms.size();
    }

    /** Milliseconds since the room's last join, leave, update or pong. */
    public long idleMillis(Room room) {
        return room.idleMillis(ticks());
    }

    public int clientCount() {
        int total = 0;
        for (Room room : rooms.values()) {
            synchronized (room) {
                total += room.size();
            }
        }
        return total;
    }

    // ========================================================================
    //  JOIN / LEAVE
    // ========================================================================

    public Client join(String roomId, String userId, ConnectionHandle connection) {
        requireId(roomId, "roomId");
        requireId(userId, "userId");
        Objects.requireNonNull(connection, "connection");

        while (true) {
            Room room = getOrCreate(roomId);
            synchronized (room) {
                // lost a race against the removal of this room's last member
                if (room.isRetired()) continue;

                long now = timestamp();
                long tick = ticks();
                Client client = new Client(roomId, userId, connection, now, tick);
                // swap in place so the room is never empty while the old session is torn down
                Client stale = room.putMember(client);
                room.markActivity(tick);
                if (stale != null) {
                    log.warn("User {} already in room {}, closing previous connection {}",
                            userId, roomId, stale.getConnection().id());
                    if (!stale.owns(connection)) stale.getConnection().close();
                    broadcastLocked(room, new ServerMessage.UserLeft(userId, now), userId);
                }
                log.info("User {} joined room {} members={}", userId, roomId, room.getMemberIds());

                broadcastLocked(room, new ServerMessage.UserJoined(userId, now), userId);
                if (sendRosterOnJoin) sendRoster(room, client, now);
                // initial probe
                if (room.getMember(userId) == client && !router.sendTo(client, ServerMessage.Ping.at(now))) {
                    log.warn("Initial ping to user {} in room {} failed, removing", userId, roomId);
                    evict(room, client, "ping failed");
                }
                return client;
            }
        }
    }

    /** Removes the user from the room; no-op if either is unknown. */
    public void leave(String roomId, String userId) {
        removeMember(roomId, userId, null, "left");
    }

    /**
     * Like {@link #leave} but only if {@code connection} still owns the membership,
     * so a superseded session closing late never evicts the session that replaced it.
     */
    public void disconnect(String roomId, String userId, ConnectionHandle connection) {
        removeMember(roomId, userId, Objects.requireNonNull(connection, "connection"), "disconnected");
    }

    private void removeMember(String roomId, String userId, ConnectionHandle origin, String reason) {
        Room room = find(roomId);
        if (room == null || userId == null) return;
        synchronized (room) {
            if (room.isRetired()) return;
            Client client = room.getMember(userId);
            if (client == null) return;
            if (origin != null && !client.owns(origin)) {
                log.debug("Ignoring {} of superseded connection {} for user {} in room {}",
                        reason, origin.id(), userId, roomId);
                return;
            }
            evict(room, client, reason);
        }
    }

    /**
     * Removes {@code client} from {@code room}, closes its connection, retires the room if it is now empty,
     * otherwise tells the remaining members. No-op if the client is no longer the registered member.
     */
    void evict(Room room, Client client, String reason) {
        synchronized (room) {
            if (room.getMember(client.getUserId()) != client) return;

            long now = timestamp();
            room.removeMember(client.getUserId());
            room.markActivity(ticks());
            client.getConnection().close();
            log.info("User {} removed from room {} ({})", client.getUserId(), room.getRoomId(), reason);

            if (room.isEmpty()) {
                retire(room);
                return;
            }
            log.info("Room {} members={}", room.getRoomId(), room.getMemberIds());
            broadcastLocked(room, new ServerMessage.UserLeft(client.getUserId(), now), client.getUserId());
        }
    }

    /** Caller holds the room's monitor. */
    private void retire(Room room) {
        room.retire();
        rooms.remove(room.getRoomId(), room);
        log.info("Deleted room {}", room.getRoomId());
    }

    /**
     * Drops the whole room without notifying its members if {@code condition} holds.
     *
     * @return the residual members, or empty if the room is unknown or the condition did not hold
     */
    public Optional<List<Client>> removeRoomIf(String roomId, Predicate<Room> condition) {
        Room room = find(roomId);
        if (room == null) return Optional.empty();
        synchronized (room) {
            if (room.isRetired() || !condition.test(room)) return Optional.empty();
            List<Client> residual = room.drainMembers();
            retire(room);
            return Optional.of(residual);
        }
    }

    // ========================================================================
    //  INBOUND TRAFFIC
    // ========================================================================

    public boolean recordUpdate(String roomId, String userId, ClientMessage.Update update) {
        return recordUpdate(roomId, userId, update, null);
    }

    /**
     * Stores the new presentation state and relays it to every other member, stamped with the receipt time.
     * Ignored if the user is not (or no longer) a member, or if {@code origin} is given and has been superseded.
     */
    public boolean recordUpdate(String roomId, String userId, ClientMessage.Update update, ConnectionHandle origin) {
        Objects.requireNonNull(update, "update");
        Room room = find(roomId);
        if (room == null) return false;
        synchronized (room) {
            Client client = currentMember(room, userId, origin);
            if (client == null) return false;

            long now = timestamp();
            long tick = ticks();
            client.applyUpdate(update.particles(), update.color(), now, tick);
            room.markActivity(tick);
            broadcastLocked(room,
                    new ServerMessage.Update(userId, now, update.particles(), update.color()),
                    userId);
            return true;
        }
    }

    public boolean touch(String roomId, String userId) {
        return touch(roomId, userId, null);
    }

    /** Refreshes liveness of a member (pong). */
    public boolean touch(String roomId, String userId, ConnectionHandle origin) {
        Room room = find(roomId);
        if (room == null) return false;
        synchronized (room) {
            Client client = currentMember(room, userId, origin);
            if (client == null) return false;
            long tick = ticks();
            client.markSeen(tick);
            room.markActivity(tick);
            return true;
        }
    }

    private static Client currentMember(Room room, String userId, ConnectionHandle origin) {
        if (room.isRetired()) return null;
        Client client = room.getMember(userId);
        if (client == null) return null;
        if (origin != null && !client.owns(origin)) return null;
        return client;
    }

    // ========================================================================
    //  BROADCAST
    // ========================================================================

    /**
     * Delivers {@code message} to every member except {@code excludeUserId}; members whose send fails are evicted.
     * Never throws for delivery problems.
     */
    public void broadcast(String roomId, ServerMessage message, String excludeUserId) {
        Room room = find(roomId);
        if (room == null) return;
        synchronized (room) {
            if (room.isRetired()) return;
            broadcastLocked(room, message, excludeUserId);
        }
    }

    /** Caller holds the room's monitor. */
    void broadcastLocked(Room room, ServerMessage message, String excludeUserId) {
        List<Client> failed = router.fanOut(room, message, excludeUserId);
        for (Client client : failed) {
            log.warn("Send to user {} in room {} failed, removing", client.getUserId(), room.getRoomId());
            evict(room, client, "send failed");
        }
    }

    /** Presentation state of every member except {@code except} (may be null). Caller holds the room's monitor. */
    static List<ServerMessage.MemberState> memberStates(Room room, Client except) {
        return room.getMembers().stream()
                .filter(c -> c != except)
                .map(c -> new ServerMessage.MemberState(c.getUserId(), c.getColor(), c.getParticles(), c.getLastUpdate()))
                .collect(Collectors.toList());
    }

    private void sendRoster(Room room, Client newcomer, long now) {
        List<ServerMessage.MemberState> others = memberStates(room, newcomer);
        if (!router.sendTo(newcomer, new ServerMessage.Init(newcomer.getUserId(), now, others))) {
            log.warn("Roster send to user {} in room {} failed, removing", newcomer.getUserId(), room.getRoomId());
            evict(room, newcomer, "send failed");
        }
    }

    // ========================================================================
    //  LIFECYCLE
    // ========================================================================

    /** Closes every connection and forgets all rooms. */
    @PreDestroy
    public void shutdown() {
        int closed = 0;
        for (Room room : rooms()) {
            List<Client> residual;
            synchronized (room) {
                residual = room.drainMembers();
                room.retire();
            }
            for (Client client : residual) {
                client.getConnection().close();
                closed++;
            }
        }
        rooms.clear();
        log.info("Room registry shut down, closed {} connection(s)", closed);
    }

    long timestamp() {
        return time.timestamp();
    }

    long ticks() {
        return time.ticks();
    }

    private static void requireId(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
