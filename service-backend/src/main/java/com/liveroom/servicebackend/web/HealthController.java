package com.liveroom.servicebackend.web;

import com.liveroom.servicebackend.room.RoomRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Health check endpoint for the live session service.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final RoomRegistry roomRegistry;

    public HealthController(RoomRegistry roomRegistry) {
        this.roomRegistry = roomRegistry;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "liveRooms", roomRegistry.liveRoomCount(),
                "services", Map.of(
                        "signaling", "/ws/signaling",
                        "rooms", "/api/rooms",
                        "ice-config", "/api/webrtc/config")));
    }
}
