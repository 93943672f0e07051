package com.liveroom.servicebackend.webrtc;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.liveroom.servicebackend.config.CallProperties;
import com.liveroom.servicebackend.room.AdmissionResult;
import com.liveroom.servicebackend.room.Participant;
import com.liveroom.servicebackend.room.ParticipantRole;
import com.liveroom.servicebackend.room.RoomEvent;
import com.liveroom.servicebackend.room.RoomEventListener;
import com.liveroom.servicebackend.room.RoomRegistry;
import com.liveroom.servicebackend.signaling.ChannelClosedException;
import com.liveroom.servicebackend.signaling.SignalingChannel;
import com.liveroom.servicebackend.signaling.SignalingCodec;
import com.liveroom.servicebackend.signaling.SignalingMessage;
import com.liveroom.servicebackend.signaling.SignalingSubscription;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lets browser clients take part in a room's signaling over WebSocket.
 *
 * Clients connect to {@code /ws/signaling?roomId=..&participantId=..&role=..}. The
 * first connection admits the participant to the room; frames received are relayed on
 * the room's channel and the participant's inbound messages are pushed back, each
 * acknowledged once written to the socket. A connection that drops without a normal
 * close keeps its seat for the reconnect grace period, and reconnecting within it
 * resumes at the first message that was not written.
 */
@Component
public class WebRTCSignalingHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(WebRTCSignalingHandler.class);

    private static final String CONNECTION_KEY = "connectionKey";
    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int SEND_BUFFER_LIMIT = 512 * 1024;

    private final RoomRegistry registry;
    private final SignalingCodec codec;
    private final CallProperties.Signaling settings;

    // "roomId/participantId" -> live connection
    private final ConcurrentHashMap<String, Connection> connections = new ConcurrentHashMap<>();
    // "roomId/participantId" -> seat release scheduled after an abnormal close
    private final ConcurrentHashMap<String, ScheduledFuture<?>> pendingReleases = new ConcurrentHashMap<>();

    private final ExecutorService pumpExecutor = Executors.newCachedThreadPool(daemon("ws-signaling-pump"));
    private final ScheduledExecutorService graceExecutor = Executors.newScheduledThreadPool(1, daemon("ws-signaling-grace"));

    public WebRTCSignalingHandler(RoomRegistry registry, SignalingCodec codec, CallProperties properties) {
        this.registry = registry;
        this.codec = codec;
        this.settings = properties.signaling();
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String roomId = extractParam(session, "roomId");
        String participantId = extractParam(session, "participantId");
        ParticipantRole role = ParticipantRole.parse(extractParam(session, "role"));

        if (isBlank(roomId) || isBlank(participantId)) {
            log.warn("WebSocket connection rejected: missing roomId or participantId");
            session.close(CloseStatus.POLICY_VIOLATION.withReason("roomId and participantId required"));
            return;
        }

        String key = key(roomId, participantId);
        ConcurrentWebSocketSessionDecorator socket =
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT);
        Connection connection = new Connection(key, roomId, participantId, socket);

        boolean resumed = reclaimSeat(key, roomId, participantId);
        SignalingChannel channel;
        if (resumed) {
            Optional<SignalingChannel> existing = registry.channel(roomId);
            if (existing.isEmpty()) {
                rejectConnection(socket, "Room " + roomId + " has ended");
                return;
            }
            channel = existing.get();
            connection.participant = registry.roster(roomId).stream()
                    .filter(member -> member.id().equals(participantId))
                    .findFirst()
                    .orElse(null);
        } else {
            Participant participant = new Participant(participantId, role);
            AdmissionResult admission = registry.admit(roomId, participant, connection);
            if (!admission.isAdmitted()) {
                log.warn("Signaling connection for {} rejected: {}", key, admission.error());
                rejectConnection(socket, admission.error().name());
                return;
            }
            channel = admission.channel();
            connection.participant = participant;
        }

        Connection previous = connections.put(key, connection);
        if (previous != null) {
            log.info("Replacing existing signaling connection for {}", key);
            previous.stop();
            closeQuietly(previous.socket, CloseStatus.NORMAL.withReason("New connection established"));
        }
        session.getAttributes().put(CONNECTION_KEY, key);

        try {
            connection.subscription = channel.subscribe(participantId);
        } catch (ChannelClosedException e) {
            connections.remove(key, connection);
            rejectConnection(socket, e.getMessage());
            return;
        }
        pumpExecutor.execute(() -> pump(connection));

        log.info("✅ Signaling WebSocket connected: participant={}, room={}, resumed={}, total_connections={}",
                participantId, roomId, resumed, connections.size());

        List<String> roster = registry.roster(roomId).stream().map(Participant::id).toList();
        connection.send(codec.encodeFrame(new ControlFrame(resumed ? "resumed" : "connected", roomId, participantId, roster)));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) throws Exception {
        String key = (String) session.getAttributes().get(CONNECTION_KEY);
        if (key == null) {
            return;
        }
        Connection connection = connections.get(key);
        if (connection == null || connection.socket.getDelegate() != session) {
            // replaced by a newer connection
            return;
        }
        connections.remove(key, connection);
        connection.stop();

        if (CloseStatus.NORMAL.equalsCode(status)) {
            log.info("❌ Signaling WebSocket closed: participant={}, room={}, remaining_connections={}",
                    connection.participantId, connection.roomId, connections.size());
            leaveRoom(connection);
            return;
        }

        long graceMs = settings.reconnectGrace().toMillis();
        log.info("Signaling WebSocket for {} dropped ({}), holding seat for {} ms", key, status, graceMs);
        synchronized (pendingReleases) {
            ScheduledFuture<?> release = graceExecutor.schedule(() -> releaseSeat(connection), graceMs, TimeUnit.MILLISECONDS);
            pendingReleases.put(key, release);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        String key = (String) session.getAttributes().get(CONNECTION_KEY);
        Connection connection = key != null ? connections.get(key) : null;
        if (connection == null) {
            log.warn("Received message from unregistered session: {}", session.getId());
            return;
        }

        SignalingMessage signalingMsg;
        try {
            signalingMsg = codec.decode(message.getPayload());
        } catch (IllegalArgumentException e) {
            log.warn("Rejected frame from {}: {}", key, e.getMessage());
            connection.send(codec.encodeError(e.getMessage()));
            return;
        }

        if (!connection.participantId.equals(signalingMsg.from())) {
            log.warn("Rejected frame from {}: sender field was {}", key, signalingMsg.from());
            connection.send(codec.encodeError("Sender does not match connection"));
            return;
        }

        log.debug("📨 Signaling message from {}: type={}, seq={}, to={}",
                key, signalingMsg.type().wireName(), signalingMsg.seq(), signalingMsg.to());

        try {
            Optional<SignalingChannel> channel = registry.channel(connection.roomId);
            if (channel.isEmpty()) {
                connection.send(codec.encodeError("Room " + connection.roomId + " has ended"));
                return;
            }
            channel.get().send(signalingMsg);
        } catch (ChannelClosedException e) {
            log.warn("Relay from {} failed: {}", key, e.getMessage());
            connection.send(codec.encodeError(e.getMessage()));
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws Exception {
        log.warn("Signaling transport error on {}: {}", session.getId(), exception.getMessage());
    }

    /**
     * Gets the number of live signaling connections.
     */
    public int getConnectedUserCount() {
        return connections.size();
    }

    public boolean isUserConnected(String roomId, String participantId) {
        Connection connection = connections.get(key(roomId, participantId));
        return connection != null && connection.socket.isOpen();
    }

    @PreDestroy
    public void shutdown() {
        connections.values().forEach(Connection::stop);
        pumpExecutor.shutdownNow();
        graceExecutor.shutdownNow();
        log.info("Signaling WebSocket handler stopped");
    }

    private void releaseSeat(Connection connection) {
        synchronized (pendingReleases) {
            if (pendingReleases.remove(connection.key) == null) {
                return;
            }
        }
        if (!connections.containsKey(connection.key)) {
            log.info("Reconnect grace expired for {}, releasing seat", connection.key);
            leaveRoom(connection);
        }
    }

    private void leaveRoom(Connection connection) {
        Participant participant = connection.participant;
        if (participant != null) {
            registry.remove(connection.roomId, participant);
        } else {
            registry.remove(connection.roomId, connection.participantId);
        }
    }

    private boolean reclaimSeat(String key, String roomId, String participantId) {
        ScheduledFuture<?> release;
        synchronized (pendingReleases) {
            release = pendingReleases.remove(key);
        }
        if (release != null) {
            release.cancel(false);
            return registry.isMember(roomId, participantId);
        }
        // a second socket for a participant already connected here takes over
        return connections.containsKey(key) && registry.isMember(roomId, participantId);
    }

    private void pump(Connection connection) {
        SignalingSubscription subscription = connection.subscription;
        try {
            while (!connection.stopped && subscription.isActive()) {
                SignalingMessage message = subscription.poll(settings.pollInterval());
                if (message == null) {
                    continue;
                }
                if (connection.send(codec.encode(message))) {
                    subscription.acknowledge(message);
                } else {
                    // left pending for the next connection
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.debug("Signaling pump for {} finished", connection.key);
    }

    private void rejectConnection(WebSocketSession socket, String reason) {
        try {
            socket.sendMessage(new TextMessage(codec.encodeError(reason)));
        } catch (IOException e) {
            log.debug("Could not deliver rejection to {}: {}", socket.getId(), e.getMessage());
        }
        closeQuietly(socket, CloseStatus.POLICY_VIOLATION.withReason(reason));
    }

    private static void closeQuietly(WebSocketSession socket, CloseStatus status) {
        try {
            socket.close(status);
        } catch (IOException e) {
            log.warn("Error closing session {}: {}", socket.getId(), e.getMessage());
        }
    }

    /**
     * Extracts a query parameter from the WebSocket handshake URI.
     */
    private static String extractParam(WebSocketSession session, String name) {
        if (session.getUri() == null) {
            return null;
        }
        String query = session.getUri().getRawQuery();
        if (query != null) {
            for (String param : query.split("&")) {
                String[] kv = param.split("=", 2);
                if (kv.length == 2 && name.equals(kv[0])) {
                    return URLDecoder.decode(kv[1], StandardCharsets.UTF_8);
                }
            }
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String key(String roomId, String participantId) {
        return roomId + "/" + participantId;
    }

    private static ThreadFactory daemon(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * One participant's socket. Also receives the room's membership events.
     */
    private final class Connection implements RoomEventListener {
        private final String key;
        private final String roomId;
        private final String participantId;
        private final ConcurrentWebSocketSessionDecorator socket;
        private volatile SignalingSubscription subscription;
        // the membership this socket holds; carried over on resume
        private volatile Participant participant;
        private volatile boolean stopped;

        private Connection(String key, String roomId, String participantId,
                ConcurrentWebSocketSessionDecorator socket) {
            this.key = key;
            this.roomId = roomId;
            this.participantId = participantId;
            this.socket = socket;
        }

        @Override
        public void onRoomEvent(RoomEvent event) {
            Connection current = connections.get(key);
            Connection target = current != null ? current : this;
            switch (event.type()) {
                case PARTICIPANT_JOINED:
                    target.send(codec.encodeFrame(new ControlFrame("participant-joined",
                            event.roomId(), event.participantId(), event.roster())));
                    break;
                case PARTICIPANT_LEFT:
                    target.send(codec.encodeFrame(new ControlFrame("participant-left",
                            event.roomId(), event.participantId(), event.roster())));
                    break;
                case ROOM_CLOSED:
                    target.send(codec.encodeFrame(new ControlFrame("room-closed", event.roomId(), null, List.of())));
                    target.stop();
                    closeQuietly(target.socket, CloseStatus.NORMAL.withReason("Room ended"));
                    break;
                default:
                    break;
            }
        }

        /**
         * @return false if the socket is closed or the write failed
         */
        private boolean send(String json) {
            if (!socket.isOpen()) {
                return false;
            }
            try {
                socket.sendMessage(new TextMessage(json));
                return true;
            } catch (IOException | IllegalStateException e) {
                log.error("Failed to send message to session {}: {}", socket.getId(), e.getMessage());
                return false;
            }
        }

        private void stop() {
            stopped = true;
            SignalingSubscription sub = subscription;
            if (sub != null) {
                sub.close();
            }
        }
    }

    /**
     * Control frame sent to the client: connection notices and room membership changes.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ControlFrame(
            String type,
            String roomId,
            String participantId,
            List<String> roster) {
    }
}
