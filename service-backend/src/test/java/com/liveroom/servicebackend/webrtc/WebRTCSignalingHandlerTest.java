package com.liveroom.servicebackend.webrtc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.liveroom.servicebackend.config.CallProperties;
import com.liveroom.servicebackend.room.RoomRegistry;
import com.liveroom.servicebackend.signaling.SignalingCodec;
import com.liveroom.servicebackend.signaling.SignalingMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.net.URI;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

class WebRTCSignalingHandlerTest {

    private RoomRegistry registry;
    private SignalingCodec codec;
    private WebRTCSignalingHandler handler;

    @BeforeEach
    void setUp() {
        CallProperties properties = properties(Duration.ofSeconds(5));
        registry = new RoomRegistry(properties.rooms());
        codec = new SignalingCodec(new ObjectMapper());
        handler = new WebRTCSignalingHandler(registry, codec, properties);
    }

    @AfterEach
    void tearDown() {
        handler.shutdown();
        registry.shutdown();
    }

    @Test
    @DisplayName("Should close connections that do not name a room and participant")
    void testMissingParamsRejected() throws Exception {
        WebSocketSession session = socket("s1", "roomId=r1");

        handler.afterConnectionEstablished(session);

        verify(session).close(argThat(status -> status.getCode() == CloseStatus.POLICY_VIOLATION.getCode()));
        assertThat(handler.getConnectedUserCount()).isZero();
        assertThat(registry.find("r1")).isEmpty();
    }

    @Test
    @DisplayName("Should admit the participant and confirm with the roster")
    void testConnectAdmits() throws Exception {
        WebSocketSession alice = socket("s1", "roomId=r1&participantId=alice&role=tutor");

        handler.afterConnectionEstablished(alice);

        assertThat(registry.isMember("r1", "alice")).isTrue();
        assertThat(handler.isUserConnected("r1", "alice")).isTrue();
        verify(alice).sendMessage(frameContaining("\"type\":\"connected\""));
    }

    @Test
    @DisplayName("Should relay an offer to the addressed participant")
    void testRelayOffer() throws Exception {
        WebSocketSession alice = socket("s1", "roomId=r1&participantId=alice");
        WebSocketSession bob = socket("s2", "roomId=r1&participantId=bob");
        handler.afterConnectionEstablished(alice);
        handler.afterConnectionEstablished(bob);

        String offer = codec.encode(SignalingMessage.offer("alice", "bob", 1, "v=0", false));
        handler.handleMessage(alice, new TextMessage(offer));

        verify(bob, timeout(2000)).sendMessage(frameContaining("\"type\":\"offer\""));
        verify(alice, timeout(2000)).sendMessage(frameContaining("\"type\":\"participant-joined\""));
    }

    @Test
    @DisplayName("Should relay camera and microphone notices to the peer")
    void testRelayMediaState() throws Exception {
        WebSocketSession alice = socket("s1", "roomId=r1&participantId=alice");
        WebSocketSession bob = socket("s2", "roomId=r1&participantId=bob");
        handler.afterConnectionEstablished(alice);
        handler.afterConnectionEstablished(bob);

        String notice = codec.encode(SignalingMessage.mediaState("alice", "bob", 1, "video", false));
        handler.handleMessage(alice, new TextMessage(notice));

        verify(bob, timeout(2000)).sendMessage(frameContaining("\"type\":\"media-state\""));
        verify(bob, timeout(2000)).sendMessage(frameContaining("\"media\":\"video\""));
        verify(alice, never()).sendMessage(frameContaining("\"type\":\"error\""));
    }

    @Test
    @DisplayName("Should relay frames from a participant who left and joined again with fresh numbering")
    void testRejoinRelaysFromFirstSequence() throws Exception {
        WebSocketSession alice = socket("s1", "roomId=r1&participantId=alice");
        WebSocketSession bob = socket("s2", "roomId=r1&participantId=bob");
        handler.afterConnectionEstablished(alice);
        handler.afterConnectionEstablished(bob);
        String offer = codec.encode(SignalingMessage.offer("bob", "alice", 1, "v=0", false));
        handler.handleMessage(bob, new TextMessage(offer));
        verify(alice, timeout(2000)).sendMessage(frameContaining("\"type\":\"offer\""));

        handler.afterConnectionClosed(bob, CloseStatus.NORMAL);
        WebSocketSession bobAgain = socket("s3", "roomId=r1&participantId=bob");
        handler.afterConnectionEstablished(bobAgain);
        handler.handleMessage(bobAgain, new TextMessage(offer));

        verify(alice, timeout(2000).times(2)).sendMessage(frameContaining("\"type\":\"offer\""));
        assertThat(registry.isMember("r1", "bob")).isTrue();
    }

    @Test
    @DisplayName("Should answer a malformed frame with an error frame")
    void testMalformedFrame() throws Exception {
        WebSocketSession alice = socket("s1", "roomId=r1&participantId=alice");
        handler.afterConnectionEstablished(alice);

        handler.handleMessage(alice, new TextMessage("{\"type\":\"offer\",\"seq\":1,\"from\":\"alice\"}"));

        verify(alice).sendMessage(frameContaining("\"type\":\"error\""));
        verify(alice, never()).close(any(CloseStatus.class));
    }

    @Test
    @DisplayName("Should refuse frames that claim another sender")
    void testSenderMismatch() throws Exception {
        WebSocketSession alice = socket("s1", "roomId=r1&participantId=alice");
        WebSocketSession bob = socket("s2", "roomId=r1&participantId=bob");
        handler.afterConnectionEstablished(alice);
        handler.afterConnectionEstablished(bob);

        String spoofed = codec.encode(SignalingMessage.bye("bob", 1));
        handler.handleMessage(alice, new TextMessage(spoofed));

        verify(alice).sendMessage(frameContaining("Sender does not match connection"));
        verify(bob, after(300).never()).sendMessage(frameContaining("\"type\":\"bye\""));
    }

    @Test
    @DisplayName("Should release the seat on a normal close")
    void testNormalCloseLeavesRoom() throws Exception {
        WebSocketSession alice = socket("s1", "roomId=r1&participantId=alice");
        WebSocketSession bob = socket("s2", "roomId=r1&participantId=bob");
        handler.afterConnectionEstablished(alice);
        handler.afterConnectionEstablished(bob);

        handler.afterConnectionClosed(bob, CloseStatus.NORMAL);

        assertThat(registry.isMember("r1", "bob")).isFalse();
        assertThat(handler.isUserConnected("r1", "bob")).isFalse();
        verify(alice).sendMessage(frameContaining("\"type\":\"participant-left\""));
    }

    @Test
    @DisplayName("Should resume a dropped connection within the grace period")
    void testReconnectWithinGrace() throws Exception {
        WebSocketSession alice = socket("s1", "roomId=r1&participantId=alice");
        WebSocketSession bob = socket("s2", "roomId=r1&participantId=bob");
        handler.afterConnectionEstablished(alice);
        handler.afterConnectionEstablished(bob);

        handler.afterConnectionClosed(bob, CloseStatus.GOING_AWAY);
        assertThat(registry.isMember("r1", "bob")).isTrue();

        String offer = codec.encode(SignalingMessage.offer("alice", "bob", 1, "v=0", false));
        handler.handleMessage(alice, new TextMessage(offer));

        WebSocketSession bobAgain = socket("s3", "roomId=r1&participantId=bob");
        handler.afterConnectionEstablished(bobAgain);

        verify(bobAgain).sendMessage(frameContaining("\"type\":\"resumed\""));
        verify(bobAgain, timeout(2000)).sendMessage(frameContaining("\"type\":\"offer\""));
        assertThat(registry.roster("r1")).hasSize(2);
    }

    @Test
    @DisplayName("Should release the seat once the grace period expires")
    void testGraceExpiry() throws Exception {
        handler.shutdown();
        registry.shutdown();
        CallProperties properties = properties(Duration.ofMillis(100));
        registry = new RoomRegistry(properties.rooms());
        handler = new WebRTCSignalingHandler(registry, codec, properties);
        WebSocketSession alice = socket("s1", "roomId=r1&participantId=alice");
        WebSocketSession bob = socket("s2", "roomId=r1&participantId=bob");
        handler.afterConnectionEstablished(alice);
        handler.afterConnectionEstablished(bob);

        handler.afterConnectionClosed(bob, CloseStatus.GOING_AWAY);

        verify(alice, timeout(2000)).sendMessage(frameContaining("\"type\":\"participant-left\""));
        assertThat(registry.isMember("r1", "bob")).isFalse();
    }

    @Test
    @DisplayName("Should turn away a participant when the room is full")
    void testRoomFull() throws Exception {
        handler.afterConnectionEstablished(socket("s1", "roomId=r1&participantId=alice"));
        handler.afterConnectionEstablished(socket("s2", "roomId=r1&participantId=bob"));
        WebSocketSession carol = socket("s3", "roomId=r1&participantId=carol");

        handler.afterConnectionEstablished(carol);

        verify(carol).sendMessage(frameContaining("ROOM_FULL"));
        verify(carol).close(argThat(status -> status.getCode() == CloseStatus.POLICY_VIOLATION.getCode()));
        assertThat(registry.roster("r1")).hasSize(2);
        assertThat(handler.isUserConnected("r1", "carol")).isFalse();
    }

    @Test
    @DisplayName("Should notify and close every socket when the room ends")
    void testRoomEnded() throws Exception {
        WebSocketSession alice = socket("s1", "roomId=r1&participantId=alice");
        WebSocketSession bob = socket("s2", "roomId=r1&participantId=bob");
        handler.afterConnectionEstablished(alice);
        handler.afterConnectionEstablished(bob);

        registry.endRoom("r1");

        for (WebSocketSession session : List.of(alice, bob)) {
            verify(session).sendMessage(frameContaining("\"type\":\"room-closed\""));
            verify(session).close(argThat(status -> status.getCode() == CloseStatus.NORMAL.getCode()));
        }
    }

    private static WebSocketSession socket(String id, String query) throws Exception {
        WebSocketSession session = mock(WebSocketSession.class);
        Map<String, Object> attributes = new HashMap<>();
        when(session.getId()).thenReturn(id);
        when(session.getUri()).thenReturn(new URI("ws://localhost:8080/ws/signaling?" + query));
        when(session.getAttributes()).thenReturn(attributes);
        when(session.isOpen()).thenReturn(true);
        return session;
    }

    private static WebSocketMessage<?> frameContaining(String fragment) {
        return argThat(message -> message != null && String.valueOf(message.getPayload()).contains(fragment));
    }

    private static CallProperties properties(Duration reconnectGrace) {
        CallProperties defaults = CallProperties.defaults();
        return new CallProperties(
                defaults.rooms(),
                defaults.negotiation(),
                defaults.ice(),
                defaults.admission(),
                new CallProperties.Signaling(reconnectGrace, Duration.ofMillis(50)),
                defaults.deviceTimeout());
    }
}
