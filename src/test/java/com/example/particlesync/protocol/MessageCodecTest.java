package com.example.particlesync.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MessageCodecTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final MessageCodec codec = new MessageCodec(mapper);

    private JsonNode encoded(ServerMessage m) throws Exception {
        return mapper.readTree(codec.encode(m));
    }

    @Test
    void encodesPresenceEventsWithTypeDiscriminator() throws Exception {
        JsonNode joined = encoded(new ServerMessage.UserJoined("bob", 42L));
        assertEquals("user_joined", joined.get("type").asText());
        assertEquals("bob", joined.get("userId").asText());
        assertEquals(42L, joined.get("timestamp").asLong());
        assertEquals(3, joined.size());

        assertEquals("user_left", encoded(new ServerMessage.UserLeft("bob", 1L)).get("type").asText());
    }

    @Test
    void pingComesFromServer() throws Exception {
        JsonNode ping = encoded(ServerMessage.Ping.at(7L));
        assertEquals("ping", ping.get("type").asText());
        assertEquals("server", ping.get("userId").asText());
    }

    @Test
    void updatePassesParticlesThroughUntouched() throws Exception {
        JsonNode particles = mapper.readTree(
                "[{\"position\":[1.5,2,3],\"rotation\":0.25,\"scale\":1,\"velocity\":[0,0,-1],\"extra\":\"kept\"}]");
        JsonNode update = encoded(new ServerMessage.Update("alice", 9L, particles, 4294967295L));

        assertEquals("update", update.get("type").asText());
        assertEquals(particles, update.get("particles"));
        assertEquals(4294967295L, update.get("color").asLong());

        JsonNode noColor = encoded(new ServerMessage.Update("alice", 9L, particles, null));
        assertFalse(noColor.has("color"));
    }

    @Test
    void initCarriesRoster() throws Exception {
        JsonNode init = encoded(new ServerMessage.Init("bob", 3L,
                List.of(new ServerMessage.MemberState("alice", 0xFFFFFFL, null, 2L))));
        assertEquals("init", init.get("type").asText());
        assertEquals("alice", init.get("clients").get(0).get("id").asText());
        assertFalse(init.get("clients").get(0).has("particles"));
    }

    @Test
    @DisplayName("decodes update with optional color")
    void decodesUpdate() throws Exception {
        ClientMessage m = codec.decode("{\"type\":\"update\",\"particles\":[{\"scale\":2}],\"color\":255}");
        ClientMessage.Update u = assertInstanceOf(ClientMessage.Update.class, m);
        assertEquals(255L, u.color());
        assertEquals(2, u.particles().get(0).get("scale").asInt());

        ClientMessage.Update noColor = assertInstanceOf(ClientMessage.Update.class,
                codec.decode("{\"type\":\"update\",\"particles\":[]}"));
        assertNull(noColor.color());
    }

    @Test
    @DisplayName("color accepts the whole uint32 range")
    void decodesColorBounds() throws Exception {
        ClientMessage.Update black = assertInstanceOf(ClientMessage.Update.class,
                codec.decode("{\"type\":\"update\",\"particles\":[],\"color\":0}"));
        assertEquals(0L, black.color());
        ClientMessage.Update max = assertInstanceOf(ClientMessage.Update.class,
                codec.decode("{\"type\":\"update\",\"particles\":[],\"color\":4294967295}"));
        assertEquals(0xFFFFFFFFL, max.color());
    }

    @Test
    void clientsSnapshotComesFromServer() throws Exception {
        JsonNode clients = encoded(ServerMessage.Clients.at(11L, List.of(
                new ServerMessage.MemberState("alice", 1L, mapper.createArrayNode(), 10L),
                new ServerMessage.MemberState("bob", 2L, null, 9L))));
        assertEquals("clients", clients.get("type").asText());
        assertEquals("server", clients.get("userId").asText());
        assertEquals(2, clients.get("clients").size());
        assertEquals("bob", clients.get("clients").get(1).get("id").asText());
    }

    @Test
    @DisplayName("decodes pong and ignores fields it does not need")
    void decodesPong() throws Exception {
        assertInstanceOf(ClientMessage.Pong.class, codec.decode("{\"type\":\"pong\"}"));
        assertInstanceOf(ClientMessage.Pong.class,
                codec.decode("{\"type\":\"pong\",\"userId\":\"alice\",\"timestamp\":1}"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "   ",
            "not json",
            "null",
            "{}",
            "{\"type\":\"ping\"}",
            "{\"type\":\"user_joined\",\"userId\":\"x\"}",
            "{\"type\":\"update\"}",
            "{\"type\":\"update\",\"particles\":{}}",
            "{\"type\":\"update\",\"particles\":[],\"color\":\"red\"}",
            "{\"type\":\"update\",\"particles\":[],\"color\":-1}",
            "{\"type\":\"update\",\"particles\":[],\"color\":4294967296}",
            "{\"type\":\"update\",\"particles\":[],\"color\":99999999999}",
            "{\"type\":\"update\",\"particles\":[],\"color\":1.9}",
            "[1,2,3]"
    })
    void rejectsMalformedFrames(String frame) {
        assertThrows(MalformedMessageException.class, () -> codec.decode(frame));
    }
}
