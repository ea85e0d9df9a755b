package com.example.particlesync.config;

import org.junit.jupiter.api.Test;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class PresencePropertiesTest {

    private static PresenceProperties of(Duration heartbeat, Duration clientTimeout, Duration roomIdle) {
        return new PresenceProperties(heartbeat, Duration.ofSeconds(30), clientTimeout, roomIdle,
                Duration.ofMinutes(5), Duration.ofSeconds(5), DataSize.ofKilobytes(512), false,
                Duration.ofMillis(50), 4);
    }

    @Test
    void defaultsMatchDocumentedValues() {
        PresenceProperties p = PresenceProperties.defaults();
        assertEquals(Duration.ofSeconds(30), p.heartbeatInterval());
        assertEquals(Duration.ofSeconds(60), p.clientTimeout());
        assertEquals(Duration.ofMinutes(5), p.roomIdleTimeout());
        assertFalse(p.sendRosterOnJoin());
        assertEquals(Duration.ofMillis(50), p.rosterInterval());
        assertEquals(4, p.dispatcherLanes());
    }

    @Test
    void clientTimeoutMustExceedHeartbeat() {
        assertThrows(IllegalArgumentException.class,
                () -> of(Duration.ofSeconds(30), Duration.ofSeconds(30), Duration.ofMinutes(5)));
    }

    @Test
    void roomIdleTimeoutMustExceedClientTimeout() {
        assertThrows(IllegalArgumentException.class,
                () -> of(Duration.ofSeconds(30), Duration.ofMinutes(5), Duration.ofMinutes(5)));
    }

    @Test
    void rosterIntervalMayBeZeroButNotNegative() {
        assertTrue(PresenceProperties.defaults().withRosterInterval(Duration.ZERO).rosterInterval().isZero());
        assertThrows(IllegalArgumentException.class,
                () -> PresenceProperties.defaults().withRosterInterval(Duration.ofMillis(-1)));
    }

    @Test
    void withSendRosterOnJoinKeepsOtherValues() {
        PresenceProperties p = PresenceProperties.defaults().withSendRosterOnJoin(true);
        assertTrue(p.sendRosterOnJoin());
        assertEquals(PresenceProperties.defaults().clientTimeout(), p.clientTimeout());
    }
}
