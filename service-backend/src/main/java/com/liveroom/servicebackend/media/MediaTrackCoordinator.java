package com.liveroom.servicebackend.media;

import com.liveroom.servicebackend.call.CallError;
import com.liveroom.servicebackend.call.CallResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Owns the outbound tracks of one session: camera, microphone and screen.
 *
 * At most one video track is published at a time. Starting a screen share moves the
 * screen track into the camera's slot and pauses the camera; stopping moves the camera
 * back with its enabled flag untouched. Neither direction renegotiates.
 *
 * All methods must be called on the owning session's serial executor; device
 * completions hop back onto it.
 */
public class MediaTrackCoordinator {
    private static final Logger log = LoggerFactory.getLogger(MediaTrackCoordinator.class);

    private final String participantId;
    private final MediaDevices devices;
    private final TrackSink sink;
    private final Executor executor;

    // confined to executor
    private Track camera;
    private Track microphone;
    private Track screen;
    private CompletableFuture<MediaSource> pendingScreen;
    private final List<CompletableFuture<MediaSource>> pendingAcquisitions = new ArrayList<>();

    private volatile boolean released;

    public MediaTrackCoordinator(String participantId, MediaDevices devices, TrackSink sink, Executor executor) {
        this.participantId = participantId;
        this.devices = devices;
        this.sink = sink;
        this.executor = executor;
    }

    /**
     * Acquires camera and microphone and publishes what was granted. A missing device
     * leaves the session receive-only for that kind.
     *
     * @return completes on the executor once both requests have settled
     */
    public CompletableFuture<Void> acquireLocalMedia() {
        CompletableFuture<Void> cameraReady = acquire(TrackSource.CAMERA).thenAcceptAsync(media -> {
            Track track = adopt(media);
            if (track != null) {
                camera = track;
                sink.publishTrack(track);
            }
        }, executor);
        CompletableFuture<Void> micReady = acquire(TrackSource.MICROPHONE).thenAcceptAsync(media -> {
            Track track = adopt(media);
            if (track != null) {
                microphone = track;
                sink.publishTrack(track);
            }
        }, executor);
        return CompletableFuture.allOf(cameraReady, micReady);
    }

    public CallResult<Boolean> setCameraEnabled(boolean enabled) {
        if (camera == null) {
            return CallResult.failure(CallError.DEVICE_UNAVAILABLE, "No camera available");
        }
        if (camera.isEnabled() != enabled) {
            camera.setEnabled(enabled);
            sink.mediaStateChanged(TrackSource.CAMERA, enabled);
        }
        log.debug("Camera of {} {}", participantId, enabled ? "enabled" : "disabled");
        return CallResult.success(enabled);
    }

    public CallResult<Boolean> setMicEnabled(boolean enabled) {
        if (microphone == null) {
            return CallResult.failure(CallError.DEVICE_UNAVAILABLE, "No microphone available");
        }
        if (microphone.isEnabled() != enabled) {
            microphone.setEnabled(enabled);
            sink.mediaStateChanged(TrackSource.MICROPHONE, enabled);
        }
        log.debug("Microphone of {} {}", participantId, enabled ? "unmuted" : "muted");
        return CallResult.success(enabled);
    }

    public CallResult<Boolean> toggleCamera() {
        if (camera == null) {
            return CallResult.failure(CallError.DEVICE_UNAVAILABLE, "No camera available");
        }
        return setCameraEnabled(!camera.isEnabled());
    }

    public CallResult<Boolean> toggleMic() {
        if (microphone == null) {
            return CallResult.failure(CallError.DEVICE_UNAVAILABLE, "No microphone available");
        }
        return setMicEnabled(!microphone.isEnabled());
    }

    /**
     * Captures the screen and swaps it into the published video slot.
     * A second request while one is active or still awaiting the picker is rejected;
     * the owning session queues its commands so that only direct callers see this.
     */
    public CompletableFuture<CallResult<Void>> startScreenShare() {
        if (released) {
            return CompletableFuture.completedFuture(
                    CallResult.failure(CallError.SESSION_ENDED, "Session is closed"));
        }
        if (screen != null || pendingScreen != null) {
            return CompletableFuture.completedFuture(
                    CallResult.failure(CallError.ALREADY_SHARING, "Screen share already active"));
        }

        CompletableFuture<MediaSource> request = request(TrackSource.SCREEN);
        pendingScreen = request;
        CompletableFuture<CallResult<Void>> result = new CompletableFuture<>();
        request.whenComplete((media, error) -> executor.execute(() -> {
            if (pendingScreen == request) {
                pendingScreen = null;
            }
            if (error != null) {
                result.complete(translate(error));
                return;
            }
            if (released) {
                media.stop();
                result.complete(CallResult.failure(CallError.SESSION_ENDED, "Session closed during capture"));
                return;
            }
            Track track = new Track(media);
            screen = track;
            if (camera != null) {
                camera.setPaused(true);
                sink.replaceTrack(camera, track);
            } else {
                sink.publishTrack(track);
            }
            media.onEnded(() -> executor.execute(() -> {
                if (screen == track) {
                    log.info("Screen capture of {} ended by the platform", participantId);
                    stopScreenShare();
                }
            }));
            sink.mediaStateChanged(TrackSource.SCREEN, true);
            log.info("Screen share started for {}", participantId);
            result.complete(CallResult.success(null));
        }));
        return result;
    }

    /**
     * Puts the camera back into the video slot. No-op when nothing is shared.
     */
    public CallResult<Void> stopScreenShare() {
        if (pendingScreen != null) {
            pendingScreen.cancel(true);
            pendingScreen = null;
        }
        Track share = screen;
        if (share == null) {
            return CallResult.success(null);
        }
        screen = null;
        if (camera != null) {
            sink.replaceTrack(share, camera);
            camera.setPaused(false);
        } else {
            sink.replaceTrack(share, null);
        }
        share.stop();
        sink.mediaStateChanged(TrackSource.SCREEN, false);
        log.info("Screen share stopped for {}", participantId);
        return CallResult.success(null);
    }

    public boolean isSharing() {
        return screen != null;
    }

    public boolean isCameraEnabled() {
        return camera != null && camera.isEnabled();
    }

    public boolean isMicEnabled() {
        return microphone != null && microphone.isEnabled();
    }

    public List<Track> tracks() {
        List<Track> tracks = new ArrayList<>(3);
        if (camera != null) {
            tracks.add(camera);
        }
        if (microphone != null) {
            tracks.add(microphone);
        }
        if (screen != null) {
            tracks.add(screen);
        }
        return tracks;
    }

    /**
     * Stops every source and abandons pending device requests. Idempotent.
     */
    public void releaseAll() {
        if (released) {
            return;
        }
        released = true;
        List<CompletableFuture<MediaSource>> pending = new ArrayList<>(pendingAcquisitions);
        pendingAcquisitions.clear();
        pending.forEach(f -> f.cancel(true));
        if (pendingScreen != null) {
            pendingScreen.cancel(true);
            pendingScreen = null;
        }
        for (Track track : tracks()) {
            track.stop();
        }
        camera = null;
        microphone = null;
        screen = null;
        log.debug("Released local media of {}", participantId);
    }

    public boolean isReleased() {
        return released;
    }

    private CompletableFuture<MediaSource> acquire(TrackSource source) {
        return request(source).handle((media, error) -> {
            if (error != null) {
                Throwable cause = unwrap(error);
                if (!(cause instanceof CancellationException)) {
                    log.warn("{} unavailable for {}: {}", source, participantId, cause.getMessage());
                }
                return null;
            }
            return media;
        });
    }

    private CompletableFuture<MediaSource> request(TrackSource source) {
        CompletableFuture<MediaSource> request = requestDevice(source);
        pendingAcquisitions.add(request);
        request.whenComplete((media, error) -> executor.execute(() -> pendingAcquisitions.remove(request)));
        return request;
    }

    private CompletableFuture<MediaSource> requestDevice(TrackSource source) {
        try {
            return devices.acquire(source);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private Track adopt(MediaSource media) {
        if (media == null) {
            return null;
        }
        if (released) {
            media.stop();
            return null;
        }
        return new Track(media);
    }

    private CallResult<Void> translate(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof DeviceAcquisitionException) {
            DeviceAcquisitionException deviceError = (DeviceAcquisitionException) cause;
            if (deviceError.reason() == DeviceAcquisitionException.Reason.DENIED) {
                log.info("Screen capture declined by {}", participantId);
                return CallResult.failure(CallError.USER_CANCELLED_CAPTURE, "Screen capture was cancelled");
            }
            return CallResult.failure(CallError.DEVICE_UNAVAILABLE, deviceError.getMessage());
        }
        if (cause instanceof CancellationException) {
            return CallResult.failure(CallError.SESSION_ENDED, "Screen capture abandoned");
        }
        log.warn("Screen capture failed for {}: {}", participantId, cause.getMessage());
        return CallResult.failure(CallError.DEVICE_UNAVAILABLE, String.valueOf(cause.getMessage()));
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
