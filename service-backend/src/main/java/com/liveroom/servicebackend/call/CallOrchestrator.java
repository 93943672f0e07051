package com.liveroom.servicebackend.call;

import com.liveroom.servicebackend.admission.AdmissionDeniedException;
import com.liveroom.servicebackend.admission.AdmissionGateway;
import com.liveroom.servicebackend.admission.AdmissionGrant;
import com.liveroom.servicebackend.config.CallProperties;
import com.liveroom.servicebackend.ice.IceConfigProvider;
import com.liveroom.servicebackend.ice.IceServer;
import com.liveroom.servicebackend.media.MediaDevices;
import com.liveroom.servicebackend.media.MediaTransport;
import com.liveroom.servicebackend.media.MediaTransportFactory;
import com.liveroom.servicebackend.media.TransportException;
import com.liveroom.servicebackend.room.AdmissionResult;
import com.liveroom.servicebackend.room.Participant;
import com.liveroom.servicebackend.room.ParticipantRole;
import com.liveroom.servicebackend.room.RoomRegistry;
import com.liveroom.servicebackend.session.CloseReason;
import com.liveroom.servicebackend.session.PeerSession;
import com.liveroom.servicebackend.session.SessionRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for in-process callers: join a room, change media, leave or end the call.
 *
 * Expected failures come back as {@link CallResult} failures; the returned futures
 * complete exceptionally only on programming errors.
 */
public class CallOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(CallOrchestrator.class);

    private final RoomRegistry registry;
    private final AdmissionGateway admissionGateway;
    private final IceConfigProvider iceConfigProvider;
    private final MediaTransportFactory transportFactory;
    private final MediaDevices devices;
    private final CallProperties properties;
    private final SessionRuntime runtime;

    // "roomId/participantId" -> live handle
    private final Map<String, SessionHandle> sessions = new ConcurrentHashMap<>();

    public CallOrchestrator(RoomRegistry registry, AdmissionGateway admissionGateway,
            IceConfigProvider iceConfigProvider, MediaTransportFactory transportFactory,
            MediaDevices devices, CallProperties properties) {
        this(registry, admissionGateway, iceConfigProvider, transportFactory, devices, properties,
                SessionRuntime.create());
    }

    public CallOrchestrator(RoomRegistry registry, AdmissionGateway admissionGateway,
            IceConfigProvider iceConfigProvider, MediaTransportFactory transportFactory,
            MediaDevices devices, CallProperties properties, SessionRuntime runtime) {
        this.registry = registry;
        this.admissionGateway = admissionGateway;
        this.iceConfigProvider = iceConfigProvider;
        this.transportFactory = transportFactory;
        this.devices = devices;
        this.properties = properties;
        this.runtime = runtime;
    }

    public CompletableFuture<CallResult<SessionHandle>> join(String sessionId, String participantId) {
        return join(sessionId, participantId, ParticipantRole.STUDENT);
    }

    /**
     * Admits the participant and starts its session. Completes once local media has
     * been acquired; connectivity to the peer follows asynchronously and is visible
     * through the handle's state. Cancelling the returned future, or local media not
     * settling within the device timeout, leaves no roster entry behind.
     */
    public CompletableFuture<CallResult<SessionHandle>> join(String sessionId, String participantId,
            ParticipantRole role) {
        CompletableFuture<CallResult<SessionHandle>> result = new CompletableFuture<>();
        runtime.workers().execute(() -> {
            try {
                admitAndStart(sessionId, participantId, role, result);
            } catch (RuntimeException e) {
                log.error("Join of {} to {} failed unexpectedly: {}", participantId, sessionId, e.getMessage(), e);
                result.complete(CallResult.failure(CallError.CALL_FAILED, e.getMessage()));
            }
        });
        return result;
    }

    private void admitAndStart(String sessionId, String participantId, ParticipantRole role,
            CompletableFuture<CallResult<SessionHandle>> result) {
        AdmissionGrant grant;
        try {
            grant = admissionGateway.requestJoin(sessionId, participantId);
        } catch (AdmissionDeniedException e) {
            result.complete(CallResult.failure(CallError.ADMISSION_DENIED, e.getMessage()));
            return;
        }
        if (result.isCancelled()) {
            return;
        }

        String roomId = grant.roomId();
        List<IceServer> iceServers = grant.iceServers().isEmpty()
                ? iceConfigProvider.fetchIceServers()
                : grant.iceServers();

        MediaTransport transport;
        try {
            transport = transportFactory.create(participantId, iceServers);
        } catch (TransportException e) {
            log.error("Could not create transport for {}: {}", participantId, e.getMessage(), e);
            result.complete(CallResult.failure(CallError.CALL_FAILED, e.getMessage()));
            return;
        }

        String key = key(roomId, participantId);
        Participant participant = new Participant(participantId, role);
        PeerSession session = new PeerSession(roomId, participantId, transport, devices, properties, runtime,
                () -> registry.remove(roomId, participant));

        AdmissionResult admission = registry.admit(roomId, participant, session);
        if (!admission.isAdmitted()) {
            transport.close();
            result.complete(CallResult.failure(admission.error(), rejection(admission)));
            return;
        }
        participant.attach(session);

        SessionHandle handle = new SessionHandle(roomId, participantId, session);
        sessions.put(key, handle);
        session.closed().whenComplete((reason, error) -> sessions.remove(key, handle));

        result.whenComplete((r, error) -> {
            if (result.isCancelled()) {
                log.info("Join of {} to room {} cancelled, compensating", participantId, roomId);
                session.close(CloseReason.localHangup("Join cancelled"));
            }
        });

        List<String> roster = admission.roster().stream().map(Participant::id).toList();
        session.start(admission.channel(), roster)
                .orTimeout(properties.deviceTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((v, error) -> {
                    if (error == null) {
                        log.info("✅ {} joined room {} (roster={})", participantId, roomId, roster);
                        result.complete(CallResult.success(handle));
                        return;
                    }
                    CallResult<SessionHandle> failure = translateStartFailure(error);
                    log.warn("Join of {} to room {} failed: {}", participantId, roomId, failure.message());
                    session.close(CloseReason.failed(failure.error(), failure.message()));
                    result.complete(failure);
                });
    }

    public CompletableFuture<CallResult<Void>> leave(SessionHandle handle) {
        PeerSession session = handle.session();
        if (session.isClosing()) {
            return CompletableFuture.completedFuture(ended());
        }
        return session.close(CloseReason.localHangup("Left the call"))
                .thenApply(reason -> CallResult.success(null));
    }

    /**
     * Ends the call for every member of the room. Calling it again, or on a session
     * that has already closed, succeeds without effect.
     */
    public CompletableFuture<CallResult<Void>> endCall(SessionHandle handle) {
        PeerSession session = handle.session();
        if (!session.isClosing()) {
            log.info("{} ended the call in room {}", handle.participantId(), handle.roomId());
            registry.endRoom(handle.roomId());
            // no-op when the room event already closed it
            session.close(CloseReason.roomEnded(handle.roomId()));
        }
        return session.closed().thenApply(reason -> CallResult.success(null));
    }

    public CompletableFuture<CallResult<Boolean>> toggleVideo(SessionHandle handle) {
        return guard(handle, handle.session().toggleCamera());
    }

    public CompletableFuture<CallResult<Boolean>> toggleAudio(SessionHandle handle) {
        return guard(handle, handle.session().toggleMic());
    }

    /**
     * @return whether a screen share is active afterwards
     */
    public CompletableFuture<CallResult<Boolean>> toggleScreenShare(SessionHandle handle) {
        return guard(handle, handle.session().toggleScreenShare());
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    /**
     * Hangs up every session this orchestrator started and stops its threads.
     */
    public void shutdown() {
        log.info("Shutting down call orchestrator ({} active sessions)", sessions.size());
        List<CompletableFuture<CloseReason>> closing = sessions.values().stream()
                .map(h -> h.session().close(CloseReason.localHangup("Service shutting down")))
                .toList();
        try {
            CompletableFuture.allOf(closing.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Not every session closed cleanly during shutdown: {}", e.getMessage());
        }
        runtime.shutdown();
    }

    private <T> CompletableFuture<CallResult<T>> guard(SessionHandle handle, CompletableFuture<CallResult<T>> action) {
        return action.handle((value, error) -> {
            if (error == null) {
                return value;
            }
            Throwable cause = unwrap(error);
            if (cause instanceof CallException) {
                CallException callError = (CallException) cause;
                return CallResult.failure(callError.error(), callError.getMessage());
            }
            log.error("Media operation failed for {}: {}", handle.participantId(), cause.getMessage(), cause);
            return CallResult.failure(CallError.CALL_FAILED, String.valueOf(cause.getMessage()));
        });
    }

    private static CallResult<SessionHandle> translateStartFailure(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof TimeoutException) {
            return CallResult.failure(CallError.DEVICE_UNAVAILABLE, "Local media was not ready in time");
        }
        if (cause instanceof CallException) {
            CallException callError = (CallException) cause;
            return CallResult.failure(callError.error(), callError.getMessage());
        }
        if (cause instanceof CancellationException) {
            return CallResult.failure(CallError.SESSION_ENDED, "Join abandoned");
        }
        return CallResult.failure(CallError.CALL_FAILED, String.valueOf(cause.getMessage()));
    }

    private static String rejection(AdmissionResult admission) {
        switch (admission.error()) {
            case ROOM_FULL:
                return "Room " + admission.roomId() + " is full";
            case ROOM_NOT_FOUND:
                return "Room " + admission.roomId() + " does not exist";
            case ALREADY_JOINED:
                return "Already in room " + admission.roomId();
            default:
                return admission.error().name();
        }
    }

    private static <T> CallResult<T> ended() {
        return CallResult.failure(CallError.SESSION_ENDED, "Session is closed");
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static String key(String roomId, String participantId) {
        return roomId + "/" + participantId;
    }
}
