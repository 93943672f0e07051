package com.liveroom.servicebackend.session;

/**
 * Receives the events of one session, in order, on the session's executor.
 * Implementations must not block.
 */
@FunctionalInterface
public interface SessionListener {

    void onSessionEvent(SessionEvent event);
}
