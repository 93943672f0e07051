package com.liveroom.servicebackend.media;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Grants every device immediately unless told otherwise.
 */
public class FakeMediaDevices implements MediaDevices {

    public enum Behavior {
        GRANT,
        DENY,
        UNAVAILABLE,
        HOLD,
        THROW
    }

    private final Map<TrackSource, Behavior> behaviors = new ConcurrentHashMap<>();
    private final List<FakeMediaSource> granted = new CopyOnWriteArrayList<>();
    private final List<CompletableFuture<MediaSource>> held = new CopyOnWriteArrayList<>();

    public FakeMediaDevices set(TrackSource source, Behavior behavior) {
        behaviors.put(source, behavior);
        return this;
    }

    @Override
    public CompletableFuture<MediaSource> acquire(TrackSource source) {
        switch (behaviors.getOrDefault(source, Behavior.GRANT)) {
            case DENY:
                return CompletableFuture.failedFuture(new DeviceAcquisitionException(source,
                        DeviceAcquisitionException.Reason.DENIED, source + " permission denied"));
            case UNAVAILABLE:
                return CompletableFuture.failedFuture(new DeviceAcquisitionException(source,
                        DeviceAcquisitionException.Reason.UNAVAILABLE, "No " + source + " found"));
            case THROW:
                throw new IllegalStateException(source + " backend crashed");
            case HOLD:
                CompletableFuture<MediaSource> pending = new CompletableFuture<>();
                held.add(pending);
                return pending;
            default:
                FakeMediaSource media = new FakeMediaSource(source);
                granted.add(media);
                return CompletableFuture.completedFuture(media);
        }
    }

    public List<FakeMediaSource> granted() {
        return List.copyOf(granted);
    }

    public List<FakeMediaSource> granted(TrackSource source) {
        return granted.stream().filter(m -> m.source() == source).toList();
    }

    public List<CompletableFuture<MediaSource>> held() {
        return List.copyOf(held);
    }

    public boolean allStopped() {
        return granted.stream().allMatch(FakeMediaSource::isStopped);
    }
}
