package com.example.particlesync.protocol;

/** Inbound frame that cannot be decoded into a {@link ClientMessage}. */
public class MalformedMessageException extends Exception {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
