package com.example.particlesync.handler;

import com.example.particlesync.config.PresenceProperties;
import com.example.particlesync.connection.ConnectionHandle;
import com.example.particlesync.connection.WebSocketConnection;
import com.example.particlesync.protocol.ClientMessage;
import com.example.particlesync.protocol.MalformedMessageException;
import com.example.particlesync.protocol.MessageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket endpoint for particle rooms.
 * - Joins by {@code ?roomId=...&userId=...}; either missing closes the socket before any room state exists
 * - Accepts JSON frames {@code {"type":"update",...}} and {@code {"type":"pong"}}
 * - Malformed frames are logged and dropped, the connection stays open
 * - Every callback becomes a {@link ConnectionEvent} handed to the {@link RoomEventDispatcher}
 */
@Component
public class ParticleWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(ParticleWebSocketHandler.class);

    private final RoomEventDispatcher dispatcher;
    private final MessageCodec codec;
    private final Duration sendTimeLimit;
    private final int sendBufferSizeLimit;

    /** Per WebSocket session → (room, user, connection) */
    private final Map<String, Conn> bySession = new ConcurrentHashMap<>();

    public ParticleWebSocketHandler(RoomEventDispatcher dispatcher, MessageCodec codec, PresenceProperties properties) {
        this.dispatcher = dispatcher;
        this.codec = codec;
        this.sendTimeLimit = properties.sendTimeLimit();
        this.sendBufferSizeLimit = (int) Math.min(Integer.MAX_VALUE, properties.sendBufferSizeLimit().toBytes());
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        Map<String, String> q = parseQuery(session.getUri());
        final String roomId = trimToNull(q.get("roomId"));
        final String userId = trimToNull(q.get("userId"));

        if (roomId == null || userId == null) {
            log.warn("WS REJECT sid={} uri={}: missing roomId or userId", session.getId(), safeUri(session));
            try { session.close(CloseStatus.POLICY_VIOLATION.withReason("roomId and userId are required")); }
            catch (Exception e) { log.debug("WS close after reject failed sid={}: {}", session.getId(), e.toString()); }
            return;
        }

        log.info("WS OPEN room={} user={} sid={}", roomId, userId, session.getId());

        ConnectionHandle connection = new WebSocketConnection(session, sendTimeLimit, sendBufferSizeLimit);
        bySession.put(session.getId(), new Conn(roomId, userId, connection));
        dispatcher.dispatch(new ConnectionEvent.Connected(roomId, userId, connection));
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        Conn c = bySession.get(session.getId());
        if (c == null) {
            log.warn("WS message from unknown session sid={}", session.getId());
            return;
        }

        ClientMessage decoded;
        try {
            decoded = codec.decode(message.getPayload());
        } catch (MalformedMessageException e) {
            log.warn("WS malformed message discarded (room={}, user={}): {}", c.room, c.user, e.getMessage());
            return;
        }
        if (log.isDebugEnabled()) {
            log.debug("WS {} from room={} user={}", decoded.getClass().getSimpleName(), c.room, c.user);
        }
        dispatcher.dispatch(new ConnectionEvent.Received(c.room, c.user, c.connection, decoded));
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        log.error("WS ERROR sid={} uri={} : transport error", session.getId(), safeUri(session), exception);
        try {
            if (session.isOpen()) session.close(CloseStatus.SERVER_ERROR);
        } catch (Exception e) {
            log.debug("WS close after transport error failed sid={}: {}", session.getId(), e.toString());
        }
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        Conn c = bySession.remove(session.getId());
        if (c == null) {
            log.info("WS CLOSE sid={} code={} reason={}", session.getId(), status.getCode(), status.getReason());
            return;
        }
        log.info("WS CLOSE room={} user={} code={} reason={}", c.room, c.user, status.getCode(), status.getReason());
        dispatcher.dispatch(new ConnectionEvent.Disconnected(c.room, c.user, c.connection));
    }

    /** Number of sessions that passed the handshake and have not closed yet. */
    public int openSessions() {
        return bySession.size();
    }

    /* ---------------- helpers ---------------- */

    private static Map<String, String> parseQuery(URI uri) {
        Map<String, String> map = new HashMap<>();
        if (uri == null || uri.getRawQuery() == null) return map;
        for (String kv : uri.getRawQuery().split("&")) {
            int i = kv.indexOf('=');
            if (i > 0) {
                String k = URLDecoder.decode(kv.substring(0, i), StandardCharsets.UTF_8);
                String v = URLDecoder.decode(kv.substring(i + 1), StandardCharsets.UTF_8);
                map.putIfAbsent(k, v);
            }
        }
        return map;
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    private String safeUri(WebSocketSession session) {
        try { return String.valueOf(session.getUri()); } catch (Exception e) { return "n/a"; }
    }

    /** Small immutable connection record. */
    private record Conn(String room, String user, ConnectionHandle connection) {
        Conn {
            Objects.requireNonNull(room, "room");
            Objects.requireNonNull(user, "user");
            Objects.requireNonNull(connection, "connection");
        }
    }
}
