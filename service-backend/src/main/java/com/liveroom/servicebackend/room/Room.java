package com.liveroom.servicebackend.room;

import com.liveroom.servicebackend.signaling.SignalingChannel;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A call room. Membership is mutated only by {@link RoomRegistry} while holding
 * {@link #lock}; reads take the same lock and return snapshots.
 */
public class Room {
    private final String id;
    private final int capacity;
    private final Instant createdAt;
    private final SignalingChannel channel;
    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock, in join order
    private final Map<String, Participant> participants = new LinkedHashMap<>();
    private final Map<String, RoomEventListener> listeners = new LinkedHashMap<>();

    private volatile RoomStatus status;
    private volatile Instant endedAt;

    Room(String id, int capacity, RoomStatus status) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Room capacity must be positive: " + capacity);
        }
        this.id = Objects.requireNonNull(id, "room id must not be null");
        this.capacity = capacity;
        this.status = status;
        this.createdAt = Instant.now();
        this.channel = new SignalingChannel(id);
    }

    public String id() {
        return id;
    }

    public int capacity() {
        return capacity;
    }

    public RoomStatus status() {
        return status;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant endedAt() {
        return endedAt;
    }

    public SignalingChannel channel() {
        return channel;
    }

    public List<Participant> participants() {
        lock.lock();
        try {
            return List.copyOf(participants.values());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return participants.size();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lock() {
        return lock;
    }

    boolean contains(String participantId) {
        return participants.containsKey(participantId);
    }

    Participant member(String participantId) {
        return participants.get(participantId);
    }

    boolean isFull() {
        return participants.size() >= capacity;
    }

    void add(Participant participant, RoomEventListener listener) {
        participants.put(participant.id(), participant);
        if (listener != null) {
            listeners.put(participant.id(), listener);
        }
        status = RoomStatus.LIVE;
    }

    Participant remove(String participantId) {
        listeners.remove(participantId);
        return participants.remove(participantId);
    }

    List<String> memberIds() {
        return new ArrayList<>(participants.keySet());
    }

    Map<String, RoomEventListener> listenersSnapshot() {
        return new LinkedHashMap<>(listeners);
    }

    void clearMembers() {
        participants.clear();
        listeners.clear();
    }

    void markEnded() {
        status = RoomStatus.ENDED;
        endedAt = Instant.now();
    }
}
