package com.example.particlesync.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.time.Duration;
import java.util.Objects;

/**
 * {@link ConnectionHandle} over a Spring {@link WebSocketSession}.
 * Sends go through a {@link ConcurrentWebSocketSessionDecorator}, so a slow peer buffers instead of
 * blocking the caller; hitting the time or buffer limit counts as a failed send.
 */
public class WebSocketConnection implements ConnectionHandle {

    private static final Logger log = LoggerFactory.getLogger(WebSocketConnection.class);

    private final WebSocketSession session;

    public WebSocketConnection(WebSocketSession session, Duration sendTimeLimit, int bufferSizeLimit) {
        Objects.requireNonNull(session, "session");
        this.session = new ConcurrentWebSocketSessionDecorator(
                session,
                (int) Math.min(Integer.MAX_VALUE, sendTimeLimit.toMillis()),
                bufferSizeLimit);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public boolean send(String frame) {
        if (!session.isOpen()) return false;
        try {
            session.sendMessage(new TextMessage(frame));
            return true;
        } catch (Exception e) {
            // IOException, SessionLimitExceededException, or IllegalStateException on a half-closed session
            log.warn("WS send failed sid={}: {}", session.getId(), e.toString());
            return false;
        }
    }

    @Override
    public void close() {
        try {
            if (session.isOpen()) session.close(CloseStatus.GOING_AWAY);
        } catch (Exception e) {
            log.debug("WS close failed sid={}: {}", session.getId(), e.toString());
        }
    }

    @Override
    public String toString() {
        return "WebSocketConnection{" + session.getId() + '}';
    }
}
