package com.liveroom.servicebackend.web;

import com.liveroom.servicebackend.ice.IceConfigProvider;
import com.liveroom.servicebackend.room.RoomRegistry;
import com.liveroom.servicebackend.web.dto.IceConfigResponse;
import com.liveroom.servicebackend.webrtc.WebRTCSignalingHandler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST API endpoints for WebRTC clients.
 * Provides ICE server configuration and signaling server status.
 */
@RestController
@RequestMapping("/api/webrtc")
public class WebRTCController {

    private final IceConfigProvider iceConfigProvider;
    private final WebRTCSignalingHandler signalingHandler;
    private final RoomRegistry roomRegistry;

    public WebRTCController(IceConfigProvider iceConfigProvider, WebRTCSignalingHandler signalingHandler,
            RoomRegistry roomRegistry) {
        this.iceConfigProvider = iceConfigProvider;
        this.signalingHandler = signalingHandler;
        this.roomRegistry = roomRegistry;
    }

    /**
     * Get STUN/TURN servers for a new peer connection. Fetched fresh on every call
     * so TURN credentials are current.
     */
    @GetMapping("/config")
    public ResponseEntity<IceConfigResponse> getIceConfig() {
        return ResponseEntity.ok(new IceConfigResponse(iceConfigProvider.fetchIceServers(), "/ws/signaling"));
    }

    /**
     * Get signaling server status.
     */
    @GetMapping("/signaling-status")
    public ResponseEntity<Map<String, Object>> getSignalingStatus() {
        return ResponseEntity.ok(Map.of(
                "connectedUsers", signalingHandler.getConnectedUserCount(),
                "liveRooms", roomRegistry.liveRoomCount(),
                "endpoint", "/ws/signaling"));
    }

    /**
     * Check if a participant is connected to a room's signaling.
     */
    @GetMapping("/signaling-status/{roomId}/{participantId}")
    public ResponseEntity<Map<String, Object>> checkParticipantConnection(@PathVariable String roomId,
            @PathVariable String participantId) {
        return ResponseEntity.ok(Map.of(
                "roomId", roomId,
                "participantId", participantId,
                "connected", signalingHandler.isUserConnected(roomId, participantId)));
    }
}
