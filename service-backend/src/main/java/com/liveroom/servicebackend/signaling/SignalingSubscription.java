package com.liveroom.servicebackend.signaling;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * A participant's view of its inbound signaling messages. Messages are handed out in
 * delivery order; a message stays pending until {@link #acknowledge(SignalingMessage)}
 * is called, so a subscription opened after a reconnect starts at the first
 * unacknowledged message. Opening a new subscription deactivates the previous one.
 */
public final class SignalingSubscription implements AutoCloseable {
    private final Mailbox mailbox;
    private final long generation;

    // guarded by the mailbox lock
    long cursor;

    SignalingSubscription(Mailbox mailbox, long generation, long cursor) {
        this.mailbox = mailbox;
        this.generation = generation;
        this.cursor = cursor;
    }

    long generation() {
        return generation;
    }

    public String participantId() {
        return mailbox.owner();
    }

    /**
     * Waits up to {@code timeout} for the next message.
     *
     * @return the next message, or null on timeout or once the subscription is inactive
     */
    public SignalingMessage poll(Duration timeout) throws InterruptedException {
        return mailbox.next(this, timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public void acknowledge(SignalingMessage message) {
        mailbox.acknowledge(message);
    }

    public boolean isActive() {
        return mailbox.isActive(this);
    }

    @Override
    public void close() {
        mailbox.cancel(this);
    }
}
