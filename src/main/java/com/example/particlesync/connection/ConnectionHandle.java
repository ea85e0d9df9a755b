package com.example.particlesync.connection;

/**
 * One transport-level connection, owned by exactly one {@code Client}.
 * Implementations never throw from {@link #send} or {@link #close}.
 */
public interface ConnectionHandle {

    /** Transport-assigned identifier, used for logging only. */
    String id();

    boolean isOpen();

    /**
     * Sends one text frame.
     *
     * @return {@code false} if the frame could not be handed to the transport
     */
    boolean send(String frame);

    /** Best-effort close; errors are ignored. */
    void close();
}
