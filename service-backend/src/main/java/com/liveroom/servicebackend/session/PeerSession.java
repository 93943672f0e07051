package com.liveroom.servicebackend.session;

import com.liveroom.servicebackend.call.CallError;
import com.liveroom.servicebackend.call.CallException;
import com.liveroom.servicebackend.call.CallResult;
import com.liveroom.servicebackend.config.CallProperties;
import com.liveroom.servicebackend.media.IceConnectionState;
import com.liveroom.servicebackend.media.MediaDevices;
import com.liveroom.servicebackend.media.MediaTrackCoordinator;
import com.liveroom.servicebackend.media.MediaTransport;
import com.liveroom.servicebackend.media.SenderSlot;
import com.liveroom.servicebackend.media.Track;
import com.liveroom.servicebackend.media.TrackSink;
import com.liveroom.servicebackend.media.TrackSource;
import com.liveroom.servicebackend.media.TransportException;
import com.liveroom.servicebackend.media.TransportListener;
import com.liveroom.servicebackend.media.TransportStats;
import com.liveroom.servicebackend.room.RoomEvent;
import com.liveroom.servicebackend.room.RoomEventListener;
import com.liveroom.servicebackend.signaling.ChannelClosedException;
import com.liveroom.servicebackend.signaling.SignalingChannel;
import com.liveroom.servicebackend.signaling.SignalingMessage;
import com.liveroom.servicebackend.signaling.SignalingPayload;
import com.liveroom.servicebackend.signaling.SignalingSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * One participant's connection to the other member of a room.
 *
 * State moves IDLE -> NEGOTIATING -> CONNECTED, through RENEGOTIATING when a track of
 * a new kind is added, to FAILED on ICE failure or negotiation timeout and finally to
 * CLOSED. A failed session gets a bounded number of ICE restarts before it is given up.
 *
 * Signaling input, transport callbacks, timers, room events and media commands are all
 * serialized on the session's own executor, so the fields below need no locking.
 * {@link #close(CloseReason)} may be called from any thread and takes effect once.
 */
public class PeerSession implements TrackSink, TransportListener, RoomEventListener {
    private static final Logger log = LoggerFactory.getLogger(PeerSession.class);

    private final String roomId;
    private final String participantId;
    private final MediaTransport transport;
    private final MediaTrackCoordinator media;
    private final CallProperties.Negotiation negotiation;
    private final Duration pollInterval;
    private final SerialExecutor executor;
    private final SessionRuntime runtime;
    private final Runnable teardownHook;

    private final AtomicBoolean closing = new AtomicBoolean();
    private final AtomicLong sequence = new AtomicLong();
    private final CompletableFuture<CloseReason> closed = new CompletableFuture<>();
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();
    private final List<SessionEvent> trace = new CopyOnWriteArrayList<>();
    private final Object mediaQueueLock = new Object();
    // guarded by mediaQueueLock; settles when the last queued media command has finished
    private CompletableFuture<?> mediaQueueTail = CompletableFuture.completedFuture(null);

    private volatile PeerState state = PeerState.IDLE;
    private volatile ConnectionQuality quality = ConnectionQuality.UNKNOWN;

    // confined to executor
    private SignalingChannel channel;
    private SignalingSubscription subscription;
    private String remotePeerId;
    private boolean offerOutstanding;
    private boolean remoteDescriptionSet;
    private boolean renegotiationPending;
    private int restarts;
    private ScheduledFuture<?> negotiationTimer;
    private ScheduledFuture<?> restartTimer;
    private final Map<String, Long> lastSeqBySender = new HashMap<>();
    private final List<SignalingPayload> pendingCandidates = new ArrayList<>();
    private final Map<SenderSlot, Track> slots = new LinkedHashMap<>();
    private final Map<String, Boolean> remoteMedia = new HashMap<>();

    public PeerSession(String roomId, String participantId, MediaTransport transport, MediaDevices devices,
            CallProperties properties, SessionRuntime runtime, Runnable teardownHook) {
        this.roomId = roomId;
        this.participantId = participantId;
        this.transport = transport;
        this.negotiation = properties.negotiation();
        this.pollInterval = properties.signaling().pollInterval();
        this.runtime = runtime;
        this.executor = new SerialExecutor(runtime.workers());
        this.teardownHook = teardownHook;
        this.media = new MediaTrackCoordinator(participantId, devices, this, executor);
    }

    /**
     * Starts negotiating over the room's channel. The second member to arrive sends
     * the offer once local media has been acquired; the first waits for it.
     *
     * @param roster ids of the room's members, including this participant
     * @return completes when local media acquisition has settled
     */
    public CompletableFuture<Void> start(SignalingChannel channel, List<String> roster) {
        CompletableFuture<Void> ready = new CompletableFuture<>();
        execute(() -> {
            if (state != PeerState.IDLE) {
                ready.completeExceptionally(new IllegalStateException("Session " + participantId + " already started"));
                return;
            }
            this.channel = channel;
            transport.setListener(this);
            try {
                subscription = channel.subscribe(participantId);
            } catch (ChannelClosedException e) {
                close(CloseReason.peerDisconnected(e.getMessage()));
                ready.completeExceptionally(e);
                return;
            }
            transition(PeerState.NEGOTIATING, "session started");
            startPump(subscription);

            if (remotePeerId == null) {
                remotePeerId = roster.stream()
                        .filter(id -> !id.equals(participantId))
                        .findFirst()
                        .orElse(null);
            }
            boolean initiator = remotePeerId != null;
            log.info("Session {} started in room {} ({})", participantId, roomId,
                    initiator ? "offering to " + remotePeerId : "awaiting offer");

            media.acquireLocalMedia().whenComplete((v, error) -> execute(() -> {
                if (!closing.get() && initiator && !offerOutstanding && !remoteDescriptionSet) {
                    sendOffer(false);
                }
                ready.complete(null);
            }));
        });
        return ready;
    }

    public String roomId() {
        return roomId;
    }

    public String participantId() {
        return participantId;
    }

    public PeerState state() {
        return state;
    }

    public ConnectionQuality quality() {
        return quality;
    }

    public boolean isClosing() {
        return closing.get();
    }

    /**
     * Completes with the close reason once teardown has finished.
     */
    public CompletableFuture<CloseReason> closed() {
        return closed;
    }

    public void addListener(SessionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SessionListener listener) {
        listeners.remove(listener);
    }

    public List<SessionEvent> trace() {
        return List.copyOf(trace);
    }

    // Media commands run one after another in submission order: a command issued while
    // an earlier one is still waiting on a device starts once that one has finished.

    public CompletableFuture<CallResult<Boolean>> toggleCamera() {
        return enqueueMedia(() -> CompletableFuture.completedFuture(media.toggleCamera()));
    }

    public CompletableFuture<CallResult<Boolean>> toggleMic() {
        return enqueueMedia(() -> CompletableFuture.completedFuture(media.toggleMic()));
    }

    /**
     * Starts a screen share, or stops the active one.
     *
     * @return whether a share is active afterwards
     */
    public CompletableFuture<CallResult<Boolean>> toggleScreenShare() {
        return enqueueMedia(() -> {
            if (media.isSharing()) {
                return CompletableFuture.completedFuture(media.stopScreenShare().map(v -> false));
            }
            return media.startScreenShare().thenApply(result -> result.map(v -> true));
        });
    }

    public CompletableFuture<CallResult<Void>> startScreenShare() {
        return enqueueMedia(media::startScreenShare);
    }

    public CompletableFuture<CallResult<Void>> stopScreenShare() {
        return enqueueMedia(() -> CompletableFuture.completedFuture(media.stopScreenShare()));
    }

    /**
     * Last media state the peer announced, keyed by media kind (video, audio, screen).
     */
    public CompletableFuture<Map<String, Boolean>> remoteMediaState() {
        CompletableFuture<Map<String, Boolean>> result = new CompletableFuture<>();
        execute(() -> result.complete(Map.copyOf(remoteMedia)));
        return result;
    }

    /**
     * Tracks currently attached to sender slots.
     */
    public CompletableFuture<List<Track>> publishedTracks() {
        CompletableFuture<List<Track>> result = new CompletableFuture<>();
        execute(() -> result.complete(slots.values().stream().filter(t -> t != null).toList()));
        return result;
    }

    public CompletableFuture<Boolean> isSharing() {
        CompletableFuture<Boolean> result = new CompletableFuture<>();
        execute(() -> result.complete(media.isSharing()));
        return result;
    }

    /**
     * Tears the session down. Only the first call has an effect; every call returns
     * the same future.
     */
    public CompletableFuture<CloseReason> close(CloseReason reason) {
        if (!closing.compareAndSet(false, true)) {
            return closed;
        }
        try {
            executor.execute(() -> teardown(reason));
        } catch (RejectedExecutionException e) {
            log.warn("Session executor unavailable, tearing down {} inline", participantId);
            teardown(reason);
        }
        return closed;
    }

    private void teardown(CloseReason reason) {
        cancelTimers();
        if (reason.cause() == CloseReason.Cause.LOCAL_HANGUP && channel != null) {
            try {
                channel.send(SignalingMessage.bye(participantId, nextSeq()));
            } catch (ChannelClosedException e) {
                log.debug("Bye from {} not delivered: {}", participantId, e.getMessage());
            }
        }
        media.releaseAll();
        slots.clear();
        pendingCandidates.clear();
        try {
            transport.close();
        } catch (TransportException e) {
            log.warn("Transport of {} failed to close cleanly: {}", participantId, e.getMessage());
        }
        if (subscription != null) {
            subscription.close();
        }
        transition(PeerState.CLOSED, reason.detail());
        try {
            teardownHook.run();
        } catch (RuntimeException e) {
            log.error("Teardown hook failed for {} in room {}: {}", participantId, roomId, e.getMessage(), e);
        }
        if (reason.isFailure()) {
            log.warn("Session {} in room {} failed: {} ({})", participantId, roomId, reason.detail(), reason.error());
        } else {
            log.info("Session {} in room {} closed: {}", participantId, roomId, reason.cause());
        }
        closed.complete(reason);
    }

    // ---- signaling input

    private void startPump(SignalingSubscription sub) {
        runtime.pumps().execute(() -> {
            try {
                while (!closing.get() && sub.isActive()) {
                    SignalingMessage message = sub.poll(pollInterval);
                    if (message != null) {
                        execute(() -> {
                            handleSignal(message);
                            sub.acknowledge(message);
                        });
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RejectedExecutionException e) {
                log.debug("Signaling pump for {} stopped: executor shut down", participantId);
            }
            log.debug("Signaling pump for {} in room {} finished", participantId, roomId);
        });
    }

    private void handleSignal(SignalingMessage message) {
        if (closing.get()) {
            return;
        }
        Long last = lastSeqBySender.get(message.from());
        if (last != null && message.seq() <= last) {
            log.debug("Ignoring stale {} #{} from {} (last {})",
                    message.type().wireName(), message.seq(), message.from(), last);
            return;
        }
        lastSeqBySender.put(message.from(), message.seq());

        try {
            switch (message.type()) {
                case OFFER:
                    onOffer(message);
                    break;
                case ANSWER:
                    onAnswer(message);
                    break;
                case CANDIDATE:
                    onCandidate(message);
                    break;
                case BYE:
                    onBye(message);
                    break;
                case MEDIA_STATE:
                    onMediaState(message);
                    break;
                default:
                    log.warn("Unhandled signaling type {} from {}", message.type(), message.from());
            }
        } catch (TransportException e) {
            log.debug("Transport rejected {} from {}: {}", message.type().wireName(), message.from(), e.getMessage());
            fail(CallError.ICE_FAILURE, "Transport error: " + e.getMessage());
        }
    }

    private void onOffer(SignalingMessage message) {
        String from = message.from();
        if (remotePeerId == null) {
            remotePeerId = from;
        } else if (!remotePeerId.equals(from)) {
            log.warn("Session {} ignoring offer from {}: already paired with {}", participantId, from, remotePeerId);
            return;
        }

        if (offerOutstanding) {
            if (participantId.compareTo(from) < 0) {
                log.info("Offer collision between {} and {}: {} yields", participantId, from, participantId);
                transport.rollbackLocalOffer();
                offerOutstanding = false;
                if (state == PeerState.RENEGOTIATING) {
                    // re-offer the rolled-back sender after this exchange
                    cancelNegotiationTimer();
                    renegotiationPending = true;
                }
            } else {
                log.info("Offer collision between {} and {}: keeping own offer", participantId, from);
                return;
            }
        }

        if (state == PeerState.FAILED) {
            cancelRestartTimer();
            restarts++;
            transition(PeerState.NEGOTIATING, "remote ICE restart");
        } else if (state == PeerState.CONNECTED) {
            transition(PeerState.RENEGOTIATING, "remote offer");
        }

        String answer = transport.createAnswer(message.payload().sdp());
        remoteDescriptionSet = true;
        flushPendingCandidates();
        send(SignalingMessage.answer(participantId, from, nextSeq(), answer));

        if (state == PeerState.RENEGOTIATING) {
            transition(PeerState.CONNECTED, "renegotiation answered");
            runPendingRenegotiation();
        } else {
            armNegotiationTimer();
        }
    }

    private void onAnswer(SignalingMessage message) {
        if (!offerOutstanding) {
            log.debug("Dropping answer from {}: no outstanding offer", message.from());
            return;
        }
        transport.applyAnswer(message.payload().sdp());
        offerOutstanding = false;
        remoteDescriptionSet = true;
        flushPendingCandidates();

        if (state == PeerState.RENEGOTIATING) {
            cancelNegotiationTimer();
            transition(PeerState.CONNECTED, "renegotiation complete");
            runPendingRenegotiation();
        }
    }

    private void onCandidate(SignalingMessage message) {
        if (remotePeerId != null && !remotePeerId.equals(message.from())) {
            return;
        }
        SignalingPayload payload = message.payload();
        if (!remoteDescriptionSet) {
            pendingCandidates.add(payload);
            log.debug("Buffered candidate from {} ({} pending)", message.from(), pendingCandidates.size());
            return;
        }
        transport.addRemoteCandidate(payload.candidate(), payload.sdpMLineIndex());
    }

    private void onBye(SignalingMessage message) {
        if (remotePeerId != null && !remotePeerId.equals(message.from())) {
            return;
        }
        close(CloseReason.peerBye(message.from()));
    }

    private void onMediaState(SignalingMessage message) {
        if (remotePeerId == null || !remotePeerId.equals(message.from())) {
            return;
        }
        SignalingPayload payload = message.payload();
        Boolean previous = remoteMedia.put(payload.media(), payload.enabled());
        if (!payload.enabled().equals(previous)) {
            emit(SessionEvent.remoteMediaChanged(participantId, message.from(), payload.media(), payload.enabled()));
        }
    }

    private void flushPendingCandidates() {
        if (pendingCandidates.isEmpty()) {
            return;
        }
        log.debug("Applying {} buffered candidates for {}", pendingCandidates.size(), participantId);
        for (SignalingPayload candidate : pendingCandidates) {
            transport.addRemoteCandidate(candidate.candidate(), candidate.sdpMLineIndex());
        }
        pendingCandidates.clear();
    }

    // ---- room events

    @Override
    public void onRoomEvent(RoomEvent event) {
        execute(() -> {
            if (closing.get()) {
                return;
            }
            switch (event.type()) {
                case PARTICIPANT_JOINED:
                    if (remotePeerId == null && !participantId.equals(event.participantId())) {
                        remotePeerId = event.participantId();
                        log.debug("Session {} expecting offer from {}", participantId, remotePeerId);
                    }
                    break;
                case PARTICIPANT_LEFT:
                    if (event.participantId().equals(remotePeerId)) {
                        close(CloseReason.peerDisconnected("Peer " + remotePeerId + " left the room"));
                    }
                    break;
                case ROOM_CLOSED:
                    close(CloseReason.roomEnded(event.roomId()));
                    break;
                default:
                    break;
            }
        });
    }

    // ---- transport callbacks

    @Override
    public void onLocalCandidate(String candidate, int sdpMLineIndex) {
        execute(() -> {
            if (closing.get() || channel == null) {
                return;
            }
            send(SignalingMessage.candidate(participantId, remotePeerId, nextSeq(), candidate, sdpMLineIndex));
        });
    }

    @Override
    public void onConnectionStateChange(IceConnectionState iceState) {
        execute(() -> {
            if (closing.get()) {
                return;
            }
            switch (iceState) {
                case CONNECTED:
                    onTransportConnected();
                    break;
                case FAILED:
                    fail(CallError.ICE_FAILURE, "ICE connectivity failed");
                    break;
                case DISCONNECTED:
                    log.warn("Transport of {} disconnected, waiting for recovery", participantId);
                    break;
                default:
                    break;
            }
        });
    }

    @Override
    public void onStats(TransportStats stats) {
        execute(() -> {
            ConnectionQuality next = ConnectionQuality.classify(stats);
            ConnectionQuality previous = quality;
            if (next != previous) {
                quality = next;
                emit(SessionEvent.qualityChanged(participantId, previous, next));
            }
        });
    }

    private void onTransportConnected() {
        restarts = 0;
        if (state == PeerState.FAILED) {
            cancelRestartTimer();
            transition(PeerState.CONNECTED, "transport recovered");
            runPendingRenegotiation();
            return;
        }
        if (state != PeerState.NEGOTIATING) {
            return;
        }
        cancelNegotiationTimer();
        transition(PeerState.CONNECTED, "transport connected");
        runPendingRenegotiation();
    }

    // ---- track publication, called by the media coordinator on the executor

    @Override
    public void publishTrack(Track track) {
        if (closing.get()) {
            return;
        }
        for (Map.Entry<SenderSlot, Track> entry : slots.entrySet()) {
            if (entry.getValue() == null && entry.getKey().kind() == track.kind()) {
                transport.replaceTrack(entry.getKey(), track);
                entry.setValue(track);
                emit(SessionEvent.trackPublished(participantId, track.id(), "reused slot " + entry.getKey().id()));
                return;
            }
        }
        SenderSlot slot = transport.addTrack(track);
        slots.put(slot, track);
        emit(SessionEvent.trackPublished(participantId, track.id(), track.source() + " on new slot " + slot.id()));
        requestRenegotiation();
    }

    @Override
    public void replaceTrack(Track current, Track replacement) {
        if (closing.get()) {
            return;
        }
        SenderSlot slot = null;
        for (Map.Entry<SenderSlot, Track> entry : slots.entrySet()) {
            if (entry.getValue() == current) {
                slot = entry.getKey();
                break;
            }
        }
        if (slot == null) {
            if (replacement != null) {
                publishTrack(replacement);
            }
            return;
        }
        transport.replaceTrack(slot, replacement);
        slots.put(slot, replacement);
        emit(SessionEvent.trackReplaced(participantId, current.id(), replacement != null ? replacement.id() : null));
    }

    @Override
    public void mediaStateChanged(TrackSource source, boolean enabled) {
        if (closing.get() || channel == null || remotePeerId == null) {
            return;
        }
        send(SignalingMessage.mediaState(participantId, remotePeerId, nextSeq(), mediaKind(source), enabled));
    }

    private static String mediaKind(TrackSource source) {
        switch (source) {
            case CAMERA:
                return SignalingPayload.MEDIA_VIDEO;
            case MICROPHONE:
                return SignalingPayload.MEDIA_AUDIO;
            default:
                return SignalingPayload.MEDIA_SCREEN;
        }
    }

    private void requestRenegotiation() {
        switch (state) {
            case CONNECTED:
                if (offerOutstanding) {
                    renegotiationPending = true;
                } else {
                    renegotiate();
                }
                break;
            case RENEGOTIATING:
                renegotiationPending = true;
                break;
            case NEGOTIATING:
                // a track added before the first exchange rides along with it
                if (offerOutstanding || remoteDescriptionSet) {
                    renegotiationPending = true;
                }
                break;
            default:
                break;
        }
    }

    private void runPendingRenegotiation() {
        if (renegotiationPending && state == PeerState.CONNECTED && !offerOutstanding) {
            renegotiate();
        }
    }

    private void renegotiate() {
        renegotiationPending = false;
        transition(PeerState.RENEGOTIATING, "track added");
        sendOffer(false);
    }

    // ---- negotiation and recovery

    private void sendOffer(boolean iceRestart) {
        String sdp;
        try {
            sdp = transport.createOffer(iceRestart);
        } catch (TransportException e) {
            fail(CallError.ICE_FAILURE, "Could not create offer: " + e.getMessage());
            return;
        }
        offerOutstanding = true;
        armNegotiationTimer();
        send(SignalingMessage.offer(participantId, remotePeerId, nextSeq(), sdp, iceRestart));
        log.debug("Session {} sent {}offer to {}", participantId, iceRestart ? "ICE restart " : "", remotePeerId);
    }

    private void armNegotiationTimer() {
        cancelNegotiationTimer();
        negotiationTimer = schedule(() -> {
            if (state == PeerState.NEGOTIATING || state == PeerState.RENEGOTIATING) {
                fail(CallError.NEGOTIATION_TIMEOUT,
                        "No connection within " + negotiation.timeout().toMillis() + " ms");
            }
        }, negotiation.timeout());
    }

    private void fail(CallError error, String detail) {
        if (closing.get() || state == PeerState.FAILED) {
            return;
        }
        cancelNegotiationTimer();
        transition(PeerState.FAILED, detail);
        if (restarts >= negotiation.maxRestarts()) {
            close(CloseReason.failed(error, detail));
            return;
        }
        restarts++;
        log.debug("Session {} will attempt ICE restart {}/{} in {} ms",
                participantId, restarts, negotiation.maxRestarts(), negotiation.retryBackoff().toMillis());
        restartTimer = schedule(this::restartIce, negotiation.retryBackoff());
    }

    private void restartIce() {
        if (state != PeerState.FAILED) {
            return;
        }
        if (offerOutstanding) {
            transport.rollbackLocalOffer();
            offerOutstanding = false;
        }
        transition(PeerState.NEGOTIATING, "ICE restart");
        sendOffer(true);
    }

    private ScheduledFuture<?> schedule(Runnable task, Duration delay) {
        return runtime.timers().schedule(() -> execute(() -> {
            if (!closing.get()) {
                task.run();
            }
        }), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void cancelNegotiationTimer() {
        if (negotiationTimer != null) {
            negotiationTimer.cancel(false);
            negotiationTimer = null;
        }
    }

    private void cancelRestartTimer() {
        if (restartTimer != null) {
            restartTimer.cancel(false);
            restartTimer = null;
        }
    }

    private void cancelTimers() {
        cancelNegotiationTimer();
        cancelRestartTimer();
    }

    // ---- helpers

    private void send(SignalingMessage message) {
        try {
            if (!channel.send(message)) {
                log.warn("Signaling {} #{} from {} was not accepted by {}",
                        message.type().wireName(), message.seq(), participantId,
                        message.isBroadcast() ? "any participant" : message.to());
            }
        } catch (ChannelClosedException e) {
            log.info("Signaling for {} lost: {}", participantId, e.getMessage());
            close(CloseReason.peerDisconnected(e.getMessage()));
        }
    }

    private long nextSeq() {
        return sequence.incrementAndGet();
    }

    private void transition(PeerState next, String detail) {
        PeerState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        log.debug("Session {}: {} -> {} ({})", participantId, previous, next, detail);
        emit(SessionEvent.stateChanged(participantId, previous, next, detail));
    }

    private void emit(SessionEvent event) {
        trace.add(event);
        for (SessionListener listener : listeners) {
            try {
                listener.onSessionEvent(event);
            } catch (RuntimeException e) {
                log.error("Session listener failed on {}: {}", event.kind(), e.getMessage(), e);
            }
        }
    }

    private void execute(Runnable task) {
        executor.execute(task);
    }

    private <T> CompletableFuture<CallResult<T>> enqueueMedia(Supplier<CompletableFuture<CallResult<T>>> command) {
        synchronized (mediaQueueLock) {
            CompletableFuture<CallResult<T>> result = mediaQueueTail
                    .thenCompose(previous -> onExecutor(command))
                    .thenCompose(f -> f);
            mediaQueueTail = result.handle((r, error) -> null);
            return result;
        }
    }

    private <T> CompletableFuture<T> onExecutor(Supplier<T> action) {
        CompletableFuture<T> result = new CompletableFuture<>();
        if (closing.get()) {
            result.completeExceptionally(new CallException(CallError.SESSION_ENDED, "Session is closed"));
            return result;
        }
        execute(() -> {
            if (closing.get()) {
                result.completeExceptionally(new CallException(CallError.SESSION_ENDED, "Session is closed"));
                return;
            }
            try {
                result.complete(action.get());
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }
}
