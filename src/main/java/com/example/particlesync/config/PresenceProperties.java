package com.example.particlesync.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Timing and transport limits of the presence core.
 * The client timeout must exceed the heartbeat interval so that at least one ping/pong
 * round trip fits before eviction; idle rooms are reaped only well after clients would time out.
 */
@Validated
@ConfigurationProperties(prefix = "app.presence")
public record PresenceProperties(
        @NotNull @DefaultValue("30s") Duration heartbeatInterval,
        @NotNull @DefaultValue("30s") Duration cleanupInterval,
        @NotNull @DefaultValue("60s") Duration clientTimeout,
        @NotNull @DefaultValue("5m") Duration roomIdleTimeout,
        @NotNull @DefaultValue("5m") Duration reaperInterval,
        @NotNull @DefaultValue("5s") Duration sendTimeLimit,
        @NotNull @DefaultValue("512KB") DataSize sendBufferSizeLimit,
        @DefaultValue("false") boolean sendRosterOnJoin,
        @NotNull @DefaultValue("50ms") Duration rosterInterval,
        @Min(1) @DefaultValue("4") int dispatcherLanes) {

    public PresenceProperties {
        if (rosterInterval != null && rosterInterval.isNegative()) {
            throw new IllegalArgumentException("app.presence.roster-interval must not be negative");
        }
        if (heartbeatInterval != null && clientTimeout != null
                && clientTimeout.compareTo(heartbeatInterval) <= 0) {
            throw new IllegalArgumentException("app.presence.client-timeout (" + clientTimeout
                    + ") must exceed app.presence.heartbeat-interval (" + heartbeatInterval + ")");
        }
        if (clientTimeout != null && roomIdleTimeout != null
                && roomIdleTimeout.compareTo(clientTimeout) <= 0) {
            throw new IllegalArgumentException("app.presence.room-idle-timeout (" + roomIdleTimeout
                    + ") must exceed app.presence.client-timeout (" + clientTimeout + ")");
        }
    }

    /** Same values as the property defaults; handy outside a Spring context. */
    public static PresenceProperties defaults() {
        return new PresenceProperties(
                Duration.ofSeconds(30),
                Duration.ofSeconds(30),
                Duration.ofSeconds(60),
                Duration.ofMinutes(5),
                Duration.ofMinutes(5),
                Duration.ofSeconds(5),
                DataSize.ofKilobytes(512),
                false,
                Duration.ofMillis(50),
                4);
    }

    public PresenceProperties withSendRosterOnJoin(boolean enabled) {
        return new PresenceProperties(heartbeatInterval, cleanupInterval, clientTimeout, roomIdleTimeout,
                reaperInterval, sendTimeLimit, sendBufferSizeLimit, enabled, rosterInterval, dispatcherLanes);
    }

    /** Zero turns the periodic room snapshot off. */
    public PresenceProperties withRosterInterval(Duration interval) {
        return new PresenceProperties(heartbeatInterval, cleanupInterval, clientTimeout, roomIdleTimeout,
                reaperInterval, sendTimeLimit, sendBufferSizeLimit, sendRosterOnJoin, interval, dispatcherLanes);
    }
}
