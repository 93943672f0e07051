package com.liveroom.servicebackend.room;

import com.liveroom.servicebackend.call.CallError;
import com.liveroom.servicebackend.config.CallProperties;
import com.liveroom.servicebackend.signaling.SignalingChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Tracks rooms, their members and capacity.
 *
 * Every admission and removal for a room runs under that room's lock, so two joins
 * racing for the last seat cannot both succeed. Events go to the listeners of the
 * affected room's members, plus any registry-wide listeners, in mutation order.
 * Ended rooms remain visible to {@link #roomStatus} until the retention window passes.
 */
public class RoomRegistry {
    private static final Logger log = LoggerFactory.getLogger(RoomRegistry.class);

    private final CallProperties.Rooms settings;
    private final ConcurrentHashMap<String, Room> rooms = new ConcurrentHashMap<>();
    private final List<RoomEventListener> globalListeners = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService cleanupExecutor = Executors.newScheduledThreadPool(1, r -> {
        Thread t = new Thread(r, "room-registry-cleanup");
        t.setDaemon(true);
        return t;
    });

    public RoomRegistry(CallProperties.Rooms settings) {
        this.settings = settings;
        long periodMs = Math.max(1000, settings.retention().toMillis());
        cleanupExecutor.scheduleAtFixedRate(
                this::purgeEndedRooms,
                periodMs,
                periodMs,
                TimeUnit.MILLISECONDS);
    }

    /**
     * Creates a scheduled room ahead of the first join. An existing live room is kept.
     */
    public Room schedule(String roomId, int capacity) {
        Room room = rooms.compute(roomId, (id, existing) ->
                existing == null || existing.status() == RoomStatus.ENDED
                        ? new Room(id, capacity, RoomStatus.SCHEDULED)
                        : existing);
        log.info("Room {} scheduled (capacity={}, status={})", roomId, room.capacity(), room.status());
        return room;
    }

    public AdmissionResult admit(String roomId, Participant participant) {
        return admit(roomId, participant, null);
    }

    /**
     * Adds the participant to the room.
     *
     * @param listener receives events about the other members until the participant leaves; may be null
     */
    public AdmissionResult admit(String roomId, Participant participant, RoomEventListener listener) {
        while (true) {
            Room room = resolve(roomId);
            if (room == null) {
                log.warn("Admission of {} rejected: room {} not found", participant.id(), roomId);
                return AdmissionResult.rejected(CallError.ROOM_NOT_FOUND, roomId);
            }

            room.lock().lock();
            try {
                if (room.status() == RoomStatus.ENDED) {
                    if (!settings.autoCreate()) {
                        return AdmissionResult.rejected(CallError.ROOM_NOT_FOUND, roomId);
                    }
                    // replaced by resolve() on the next pass
                    rooms.remove(roomId, room);
                    continue;
                }
                if (room.contains(participant.id())) {
                    log.warn("Admission of {} rejected: already in room {}", participant.id(), roomId);
                    return AdmissionResult.rejected(CallError.ALREADY_JOINED, roomId);
                }
                if (room.isFull()) {
                    log.warn("Admission of {} rejected: room {} is full ({}/{})",
                            participant.id(), roomId, room.size(), room.capacity());
                    return AdmissionResult.rejected(CallError.ROOM_FULL, roomId);
                }

                Map<String, RoomEventListener> others = room.listenersSnapshot();
                room.add(participant, listener);
                room.channel().open(participant.id());
                List<String> roster = room.memberIds();
                log.info("Participant {} joined room {} ({}/{})",
                        participant, roomId, roster.size(), room.capacity());

                publish(RoomEvent.joined(roomId, participant.id(), roster), others);
                return AdmissionResult.admitted(roomId, participant, room.channel(), room.participants());
            } finally {
                room.lock().unlock();
            }
        }
    }

    /**
     * Removes the participant. Removing a non-member is a no-op. The last departure
     * ends the room.
     */
    public void remove(String roomId, String participantId) {
        removeMember(roomId, participantId, null);
    }

    /**
     * Removes this exact membership. A no-op once the participant has left, even if
     * they have since rejoined the room, or a new room under the same id, as a new member.
     */
    public void remove(String roomId, Participant participant) {
        removeMember(roomId, participant.id(), participant);
    }

    private void removeMember(String roomId, String participantId, Participant expected) {
        Room room = rooms.get(roomId);
        if (room == null) {
            return;
        }
        room.lock().lock();
        try {
            if (expected != null && room.member(participantId) != expected) {
                log.debug("Skipping removal of {} from room {}: membership already replaced", participantId, roomId);
                return;
            }
            Participant removed = room.remove(participantId);
            if (removed == null) {
                return;
            }
            removed.detach();
            room.channel().close(participantId);
            List<String> roster = room.memberIds();
            log.info("Participant {} left room {} (remaining={})", participantId, roomId, roster.size());

            Map<String, RoomEventListener> remaining = room.listenersSnapshot();
            publish(RoomEvent.left(roomId, participantId, roster), remaining);

            if (roster.isEmpty()) {
                closeLocked(room, Map.of());
            }
        } finally {
            room.lock().unlock();
        }
    }

    /**
     * Ends the room for every member. Idempotent.
     */
    public void endRoom(String roomId) {
        Room room = rooms.get(roomId);
        if (room == null) {
            return;
        }
        room.lock().lock();
        try {
            if (room.status() == RoomStatus.ENDED) {
                return;
            }
            Map<String, RoomEventListener> members = room.listenersSnapshot();
            room.participants().forEach(Participant::detach);
            room.clearMembers();
            log.info("Room {} ended explicitly ({} members notified)", roomId, members.size());
            closeLocked(room, members);
        } finally {
            room.lock().unlock();
        }
    }

    private void closeLocked(Room room, Map<String, RoomEventListener> members) {
        room.markEnded();
        room.channel().shutdown();
        publish(RoomEvent.closed(room.id()), members);
        log.info("Room {} closed", room.id());
    }

    public Optional<RoomStatus> roomStatus(String roomId) {
        Room room = rooms.get(roomId);
        return room != null ? Optional.of(room.status()) : Optional.empty();
    }

    public Optional<Room> find(String roomId) {
        return Optional.ofNullable(rooms.get(roomId));
    }

    public List<Participant> roster(String roomId) {
        Room room = rooms.get(roomId);
        return room != null ? room.participants() : List.of();
    }

    public boolean isMember(String roomId, String participantId) {
        Room room = rooms.get(roomId);
        if (room == null) {
            return false;
        }
        room.lock().lock();
        try {
            return room.contains(participantId);
        } finally {
            room.lock().unlock();
        }
    }

    public Optional<SignalingChannel> channel(String roomId) {
        return find(roomId).filter(r -> r.status() != RoomStatus.ENDED).map(Room::channel);
    }

    public int liveRoomCount() {
        return (int) rooms.values().stream().filter(r -> r.status() == RoomStatus.LIVE).count();
    }

    public void addListener(RoomEventListener listener) {
        globalListeners.add(listener);
    }

    public void removeListener(RoomEventListener listener) {
        globalListeners.remove(listener);
    }

    public void shutdown() {
        cleanupExecutor.shutdownNow();
        rooms.values().forEach(room -> room.channel().shutdown());
        rooms.clear();
        log.info("Room registry shut down");
    }

    private Room resolve(String roomId) {
        if (!settings.autoCreate()) {
            return rooms.get(roomId);
        }
        return rooms.compute(roomId, (id, existing) ->
                existing == null || existing.status() == RoomStatus.ENDED
                        ? new Room(id, settings.defaultCapacity(), RoomStatus.LIVE)
                        : existing);
    }

    private void publish(RoomEvent event, Map<String, RoomEventListener> memberListeners) {
        for (Map.Entry<String, RoomEventListener> entry : memberListeners.entrySet()) {
            if (entry.getKey().equals(event.participantId())) {
                continue;
            }
            deliver(entry.getValue(), event);
        }
        for (RoomEventListener listener : globalListeners) {
            deliver(listener, event);
        }
    }

    private void deliver(RoomEventListener listener, RoomEvent event) {
        try {
            listener.onRoomEvent(event);
        } catch (RuntimeException e) {
            log.error("Room event listener failed for {} in room {}: {}",
                    event.type(), event.roomId(), e.getMessage(), e);
        }
    }

    /**
     * Drops ended rooms whose retention window has passed.
     */
    void purgeEndedRooms() {
        Instant cutoff = Instant.now().minus(settings.retention());
        purgeEndedBefore(cutoff);
    }

    void purgeEndedBefore(Instant cutoff) {
        var expired = rooms.values().stream()
                .filter(r -> r.status() == RoomStatus.ENDED)
                .filter(r -> r.endedAt() != null && r.endedAt().isBefore(cutoff))
                .toList();

        for (Room room : expired) {
            if (rooms.remove(room.id(), room)) {
                log.info("Room {} purged after retention", room.id());
            }
        }
    }
}
