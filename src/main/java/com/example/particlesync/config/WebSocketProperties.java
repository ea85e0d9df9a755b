package com.example.particlesync.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.stream.Collectors;

/**
 * WebSocket endpoint settings.
 * {@code allowedOrigins} is the browser origin list checked on the handshake; {@code *} accepts any origin.
 */
@Validated
@ConfigurationProperties(prefix = "app.websocket")
public record WebSocketProperties(
        @NotBlank @DefaultValue("/ws") String path,
        @NotEmpty @DefaultValue("http://localhost:5173") List<String> allowedOrigins) {

    public WebSocketProperties {
        allowedOrigins = (allowedOrigins == null) ? List.of() : allowedOrigins.stream()
                .map(String::trim)
                .filter(o -> !o.isEmpty())
                .distinct()
                .collect(Collectors.toList());
    }
}
