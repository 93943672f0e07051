package com.liveroom.servicebackend.room;

@FunctionalInterface
public interface RoomEventListener {

    /**
     * Called while the room's lock is held, in mutation order. Implementations must
     * hand work off rather than block.
     */
    void onRoomEvent(RoomEvent event);
}
