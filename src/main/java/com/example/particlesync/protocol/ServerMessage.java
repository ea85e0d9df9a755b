package com.example.particlesync.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Messages the server pushes to connections. {@code userId} is the subject of the event,
 * not necessarily the recipient; {@code timestamp} is the server receipt time in epoch millis.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ServerMessage.UserJoined.class, name = "user_joined"),
        @JsonSubTypes.Type(value = ServerMessage.UserLeft.class, name = "user_left"),
        @JsonSubTypes.Type(value = ServerMessage.Update.class, name = "update"),
        @JsonSubTypes.Type(value = ServerMessage.Ping.class, name = "ping"),
        @JsonSubTypes.Type(value = ServerMessage.Init.class, name = "init"),
        @JsonSubTypes.Type(value = ServerMessage.Clients.class, name = "clients")
})
public sealed interface ServerMessage
        permits ServerMessage.UserJoined, ServerMessage.UserLeft, ServerMessage.Update,
                ServerMessage.Ping, ServerMessage.Init, ServerMessage.Clients {

    /** userId carried by heartbeat probes and room snapshots. */
    String SERVER_USER_ID = "server";

    String userId();

    long timestamp();

    @JsonTypeName("user_joined")
    record UserJoined(String userId, long timestamp) implements ServerMessage { }

    @JsonTypeName("user_left")
    record UserLeft(String userId, long timestamp) implements ServerMessage { }

    @JsonTypeName("update")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Update(String userId, long timestamp, JsonNode particles, Long color) implements ServerMessage { }

    @JsonTypeName("ping")
    record Ping(String userId, long timestamp) implements ServerMessage {
        public static Ping at(long timestamp) {
            return new Ping(SERVER_USER_ID, timestamp);
        }
    }

    /** Roster of the other members, sent only to a joining user. */
    @JsonTypeName("init")
    record Init(String userId, long timestamp, List<MemberState> clients) implements ServerMessage {
        public Init {
            clients = (clients == null) ? List.of() : List.copyOf(clients);
        }
    }

    /** Periodic snapshot of every member of a room, sent to the whole room. */
    @JsonTypeName("clients")
    record Clients(String userId, long timestamp, List<MemberState> clients) implements ServerMessage {
        public Clients {
            clients = (clients == null) ? List.of() : List.copyOf(clients);
        }

        public static Clients at(long timestamp, List<MemberState> clients) {
            return new Clients(SERVER_USER_ID, timestamp, clients);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record MemberState(String id, long color, JsonNode particles, long lastUpdate) { }
}
