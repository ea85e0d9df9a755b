package com.example.particlesync.config;

import com.example.particlesync.handler.ConnectionEventProcessor;
import com.example.particlesync.handler.RoomEventDispatcher;
import com.example.particlesync.service.PresenceClock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(PresenceProperties.class)
public class PresenceConfig {

    @Bean
    public PresenceClock presenceClock() {
        return PresenceClock.system();
    }

    @Bean(destroyMethod = "close")
    public RoomEventDispatcher roomEventDispatcher(ConnectionEventProcessor processor, PresenceProperties properties) {
        return RoomEventDispatcher.withLanes(processor, properties.dispatcherLanes());
    }
}
