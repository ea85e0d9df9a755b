package com.example.particlesync.controller;

import com.example.particlesync.service.RoomRegistry;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

  private final RoomRegistry registry;

  public HealthController(RoomRegistry registry) {
    this.registry = registry;
  }

  /** Liveness probe */
  @GetMapping("/healthz")
  public String healthz() {
    return "ok";
  }

  /** Human-readable status with in-memory counts */
  @GetMapping("/admin/health")
  public Map<String, Object> adminHealth() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("app", "ok");
    m.put("rooms", registry.roomCount());
    m.put("clients", registry.clientCount());
    return m;
  }
}
