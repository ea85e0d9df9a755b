package com.example.particlesync.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.springframework.stereotype.Component;

/** JSON wire encoding for {@link ServerMessage} and {@link ClientMessage}. */
@Component
public class MessageCodec {

    /** Colors are uint32 values. */
    static final long MAX_COLOR = 0xFFFFFFFFL;

    private final ObjectWriter writer;
    private final ObjectReader reader;

    public MessageCodec(ObjectMapper objectMapper) {
        this.writer = objectMapper.writerFor(ServerMessage.class);
        this.reader = objectMapper.readerFor(ClientMessage.class)
                .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                // 1.9 must not become color 1
                .without(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
    }

    public String encode(ServerMessage message) {
        try {
            return writer.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode " + message.getClass().getSimpleName(), e);
        }
    }

    public ClientMessage decode(String frame) throws MalformedMessageException {
        if (frame == null || frame.isBlank()) {
            throw new MalformedMessageException("empty frame");
        }
        ClientMessage message;
        try {
            message = reader.readValue(frame);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("unparseable frame: " + e.getOriginalMessage(), e);
        }
        if (message == null) {
            throw new MalformedMessageException("null frame");
        }
        if (message instanceof ClientMessage.Update u) {
            if (u.particles() == null || !u.particles().isArray()) {
                throw new MalformedMessageException("update without particles array");
            }
            if (u.color() != null && (u.color() < 0 || u.color() > MAX_COLOR)) {
                throw new MalformedMessageException("color out of uint32 range: " + u.color());
            }
        }
        return message;
    }
}
