package com.example.particlesync.handler;

import com.example.particlesync.MutableClock;
import com.example.particlesync.config.PresenceProperties;
import com.example.particlesync.model.Room;
import com.example.particlesync.protocol.MessageCodec;
import com.example.particlesync.service.BroadcastRouter;
import com.example.particlesync.service.RoomRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.net.URI;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Drives the handler with mocked sessions; events are applied inline so the registry can be inspected right away.
 */
class ParticleWebSocketHandlerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private RoomRegistry registry;
    private ParticleWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        PresenceProperties props = PresenceProperties.defaults();
        MessageCodec codec = new MessageCodec(mapper);
        registry = new RoomRegistry(new BroadcastRouter(codec), new MutableClock(1_000L).presenceClock(), props);
        Executor inline = Runnable::run;
        RoomEventDispatcher dispatcher =
                new RoomEventDispatcher(new ConnectionEventProcessor(registry), List.of(inline));
        handler = new ParticleWebSocketHandler(dispatcher, codec, props);
    }

    private WebSocketSession session(String id, String query) {
        WebSocketSession s = mock(WebSocketSession.class);
        when(s.getId()).thenReturn(id);
        when(s.getUri()).thenReturn(URI.create("ws://localhost:3000/ws" + (query == null ? "" : "?" + query)));
        when(s.isOpen()).thenReturn(true);
        return s;
    }

    private List<JsonNode> sent(WebSocketSession s) throws Exception {
        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(s, atLeastOnce()).sendMessage(captor.capture());
        return captor.getAllValues().stream()
                .map(m -> {
                    try { return mapper.readTree(m.getPayload()); }
                    catch (Exception e) { throw new IllegalStateException(e); }
                })
                .collect(Collectors.toList());
    }

    @Test
    @DisplayName("missing userId closes the socket and creates no room")
    void rejectsIncompleteHandshake() throws Exception {
        WebSocketSession s = session("s1", "roomId=R1");

        handler.afterConnectionEstablished(s);

        ArgumentCaptor<CloseStatus> status = ArgumentCaptor.forClass(CloseStatus.class);
        verify(s).close(status.capture());
        assertEquals(CloseStatus.POLICY_VIOLATION.getCode(), status.getValue().getCode());
        assertEquals(0, registry.roomCount());
        assertEquals(0, handler.openSessions());
    }

    @Test
    void rejectsBlankRoomId() throws Exception {
        WebSocketSession s = session("s1", "roomId=%20&userId=alice");
        handler.afterConnectionEstablished(s);
        verify(s).close(any(CloseStatus.class));
        assertEquals(0, registry.roomCount());
    }

    @Test
    @DisplayName("join, relay an update, then leave on close")
    void fullConnectionLifecycle() throws Exception {
        WebSocketSession alice = session("s-a", "roomId=R%201&userId=alice");
        WebSocketSession bob = session("s-b", "roomId=R%201&userId=bob");

        handler.afterConnectionEstablished(alice);
        handler.afterConnectionEstablished(bob);

        Room room = registry.find("R 1");
        assertNotNull(room);
        assertEquals(List.of("alice", "bob"), room.getMemberIds());

        handler.handleTextMessage(alice, new TextMessage(
                "{\"type\":\"update\",\"particles\":[{\"position\":[0,1,2],\"rotation\":0,\"scale\":1,\"velocity\":[0,0,0]}],\"color\":16711680}"));

        List<JsonNode> toBob = sent(bob);
        assertEquals(2, toBob.size());
        assertEquals("ping", toBob.get(0).get("type").asText());
        assertEquals("update", toBob.get(1).get("type").asText());
        assertEquals("alice", toBob.get(1).get("userId").asText());
        assertEquals(16711680L, toBob.get(1).get("color").asLong());

        handler.afterConnectionClosed(bob, CloseStatus.NORMAL);

        assertEquals(List.of("alice"), registry.find("R 1").getMemberIds());
        List<JsonNode> toAlice = sent(alice);
        assertEquals("ping", toAlice.get(0).get("type").asText());
        assertEquals("user_joined", toAlice.get(1).get("type").asText());
        assertEquals("user_left", toAlice.get(toAlice.size() - 1).get("type").asText());
        assertEquals("bob", toAlice.get(toAlice.size() - 1).get("userId").asText());
        assertEquals(1, handler.openSessions());
    }

    @Test
    @DisplayName("malformed frames are dropped and the connection stays open")
    void malformedFrameIsDiscarded() throws Exception {
        WebSocketSession alice = session("s-a", "roomId=R1&userId=alice");
        handler.afterConnectionEstablished(alice);

        assertDoesNotThrow(() -> handler.handleTextMessage(alice, new TextMessage("{oops")));
        assertDoesNotThrow(() -> handler.handleTextMessage(alice, new TextMessage("{\"type\":\"dance\"}")));

        verify(alice, never()).close(any(CloseStatus.class));
        verify(alice, never()).close();
        assertEquals(1, registry.find("R1").size());
    }

    @Test
    void pongRefreshesLiveness() throws Exception {
        MutableClock clock = new MutableClock(0L);
        PresenceProperties props = PresenceProperties.defaults();
        MessageCodec codec = new MessageCodec(mapper);
        registry = new RoomRegistry(new BroadcastRouter(codec), clock.presenceClock(), props);
        handler = new ParticleWebSocketHandler(
                new RoomEventDispatcher(new ConnectionEventProcessor(registry), List.of((Executor) Runnable::run)),
                codec, props);

        WebSocketSession alice = session("s-a", "roomId=R1&userId=alice");
        handler.afterConnectionEstablished(alice);
        clock.advanceMillis(12_345);

        handler.handleTextMessage(alice, new TextMessage("{\"type\":\"pong\"}"));

        assertEquals(12_345L, registry.find("R1").getMember("alice").getLastSeen());
    }

    @Test
    void messageFromUnknownSessionIsIgnored() throws Exception {
        WebSocketSession stranger = session("s-x", "roomId=R1&userId=x");
        assertDoesNotThrow(() -> handler.handleTextMessage(stranger, new TextMessage("{\"type\":\"pong\"}")));
        assertEquals(0, registry.roomCount());
    }

    @Test
    void transportErrorClosesSession() throws Exception {
        WebSocketSession alice = session("s-a", "roomId=R1&userId=alice");
        handler.afterConnectionEstablished(alice);

        handler.handleTransportError(alice, new java.io.IOException("reset by peer"));

        verify(alice).close(CloseStatus.SERVER_ERROR);
    }
}
