package com.liveroom.servicebackend.web;

import com.liveroom.servicebackend.config.CallProperties;
import com.liveroom.servicebackend.room.Room;
import com.liveroom.servicebackend.room.RoomRegistry;
import com.liveroom.servicebackend.room.RoomStatus;
import com.liveroom.servicebackend.web.dto.CreateRoomRequest;
import com.liveroom.servicebackend.web.dto.RoomResponse;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * REST API for scheduling rooms, looking up their status and ending them.
 */
@RestController
@RequestMapping("/api/rooms")
@Validated
public class RoomController {
    private static final Logger log = LoggerFactory.getLogger(RoomController.class);

    private final RoomRegistry roomRegistry;
    private final CallProperties properties;

    public RoomController(RoomRegistry roomRegistry, CallProperties properties) {
        this.roomRegistry = roomRegistry;
        this.properties = properties;
    }

    /**
     * Schedules a room. Fails with 409 if a room with the same id is still open.
     */
    @PostMapping
    public ResponseEntity<RoomResponse> createRoom(@Valid @RequestBody CreateRoomRequest request) {
        Optional<RoomStatus> existing = roomRegistry.roomStatus(request.roomId());
        if (existing.isPresent() && existing.get() != RoomStatus.ENDED) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(RoomResponse.failure("Room " + request.roomId() + " already exists"));
        }

        int capacity = request.capacity() != null ? request.capacity() : properties.rooms().defaultCapacity();
        Room room = roomRegistry.schedule(request.roomId(), capacity);
        log.info("Room {} scheduled via REST", room.id());
        return ResponseEntity.status(HttpStatus.CREATED).body(RoomResponse.success(room));
    }

    /**
     * Gets a room's status and roster. Ended rooms stay visible until they are purged.
     */
    @GetMapping("/{roomId}")
    public ResponseEntity<RoomResponse> getRoom(@PathVariable String roomId) {
        return roomRegistry.find(roomId)
                .map(room -> ResponseEntity.ok(RoomResponse.success(room)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(RoomResponse.failure("Room " + roomId + " not found")));
    }

    /**
     * Ends the room for every participant.
     */
    @DeleteMapping("/{roomId}")
    public ResponseEntity<RoomResponse> endRoom(@PathVariable String roomId) {
        Optional<Room> room = roomRegistry.find(roomId);
        if (room.isEmpty() || room.get().status() == RoomStatus.ENDED) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(RoomResponse.failure("Room " + roomId + " not found or already ended"));
        }
        roomRegistry.endRoom(roomId);
        return ResponseEntity.ok(RoomResponse.success(room.get()));
    }
}
