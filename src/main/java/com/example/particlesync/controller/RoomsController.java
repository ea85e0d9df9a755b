package com.example.particlesync.controller;

import com.example.particlesync.model.Room;
import com.example.particlesync.service.RoomRegistry;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/** Read-only view of the live rooms (informational; never mutates state). */
@Validated
@RestController
@RequestMapping("/api/rooms")
public class RoomsController {

  private final RoomRegistry registry;

  public RoomsController(RoomRegistry registry) {
    this.registry = registry;
  }

  public record RoomSummary(String roomId, List<String> members, long createdAt, long idleMillis) { }

  private RoomSummary summarize(Room room) {
    synchronized (room) {
      return new RoomSummary(room.getRoomId(), room.getMemberIds(), room.getCreatedAt(), registry.idleMillis(room));
    }
  }

  @GetMapping
  public List<RoomSummary> list() {
    return registry.rooms().stream()
        .map(this::summarize)
        .sorted(Comparator.comparing(RoomSummary::roomId))
        .collect(Collectors.toList());
  }

  @GetMapping("/{roomId}")
  public ResponseEntity<RoomSummary> get(@PathVariable("roomId") @NotBlank String roomId) {
    Room room = registry.find(roomId);
    if (room == null) return ResponseEntity.notFound().build();
    return ResponseEntity.ok(summarize(room));
  }
}
