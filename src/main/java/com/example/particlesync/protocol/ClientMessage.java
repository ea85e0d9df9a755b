package com.example.particlesync.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.databind.JsonNode;

/** Messages accepted from a joined connection. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ClientMessage.Update.class, name = "update"),
        @JsonSubTypes.Type(value = ClientMessage.Pong.class, name = "pong")
})
public sealed interface ClientMessage permits ClientMessage.Update, ClientMessage.Pong {

    /**
     * New presentation state. {@code particles} is passed through untouched;
     * {@code color} is an optional uint32 RGB value.
     */
    @JsonTypeName("update")
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Update(JsonNode particles, Long color) implements ClientMessage { }

    /** Heartbeat answer; only refreshes liveness. */
    @JsonTypeName("pong")
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Pong() implements ClientMessage { }
}
