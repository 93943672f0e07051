package com.liveroom.servicebackend.signaling;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Inbound queue of one participant. Keeps every accepted message until it is
 * acknowledged so that a replacement subscription resumes without gaps, and drops
 * messages whose sequence number is not above the last one accepted from that sender.
 *
 * Senders are told apart by their own endpoint, not their id: a participant who leaves
 * and rejoins gets a new endpoint and starts numbering at 1 again.
 */
final class Mailbox {
    private final String owner;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition arrived = lock.newCondition();

    // guarded by lock
    private final List<SignalingMessage> pending = new ArrayList<>();
    private final Map<Mailbox, Long> highestSeqBySender = new HashMap<>();
    private long firstPendingOffset;
    private long generation;
    private boolean closed;

    Mailbox(String owner) {
        this.owner = owner;
    }

    String owner() {
        return owner;
    }

    /**
     * @return false if the message is a duplicate or arrived out of order
     * @throws ChannelClosedException if the owner's endpoint was closed
     */
    boolean offer(SignalingMessage message, Mailbox senderEndpoint) {
        lock.lock();
        try {
            if (closed) {
                throw new ChannelClosedException("Participant " + owner + " has left the channel");
            }
            Long highest = highestSeqBySender.get(senderEndpoint);
            if (highest != null && message.seq() <= highest) {
                return false;
            }
            highestSeqBySender.put(senderEndpoint, message.seq());
            pending.add(message);
            arrived.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops the sequence high-water mark kept for a sender endpoint that was closed.
     */
    void forgetSender(Mailbox sender) {
        lock.lock();
        try {
            highestSeqBySender.remove(sender);
        } finally {
            lock.unlock();
        }
    }

    SignalingSubscription subscribe() {
        lock.lock();
        try {
            if (closed) {
                throw new ChannelClosedException("Participant " + owner + " has left the channel");
            }
            generation++;
            arrived.signalAll();
            return new SignalingSubscription(this, generation, firstPendingOffset);
        } finally {
            lock.unlock();
        }
    }

    SignalingMessage next(SignalingSubscription subscription, long timeout, TimeUnit unit) throws InterruptedException {
        long remaining = unit.toNanos(timeout);
        lock.lock();
        try {
            while (true) {
                if (closed || subscription.generation() != generation) {
                    return null;
                }
                if (subscription.cursor < firstPendingOffset) {
                    subscription.cursor = firstPendingOffset;
                }
                long index = subscription.cursor - firstPendingOffset;
                if (index < pending.size()) {
                    subscription.cursor++;
                    return pending.get((int) index);
                }
                if (remaining <= 0) {
                    return null;
                }
                remaining = arrived.awaitNanos(remaining);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Acknowledges the message and everything delivered before it.
     */
    void acknowledge(SignalingMessage message) {
        lock.lock();
        try {
            int index = indexOf(message);
            if (index >= 0) {
                pending.subList(0, index + 1).clear();
                firstPendingOffset += index + 1;
            }
        } finally {
            lock.unlock();
        }
    }

    // the delivered instance first: a rejoined sender may reuse an old sequence number
    private int indexOf(SignalingMessage message) {
        for (int i = 0; i < pending.size(); i++) {
            if (pending.get(i) == message) {
                return i;
            }
        }
        for (int i = 0; i < pending.size(); i++) {
            SignalingMessage candidate = pending.get(i);
            if (candidate.seq() == message.seq() && candidate.from().equals(message.from())) {
                return i;
            }
        }
        return -1;
    }

    boolean isActive(SignalingSubscription subscription) {
        lock.lock();
        try {
            return !closed && subscription.generation() == generation;
        } finally {
            lock.unlock();
        }
    }

    void cancel(SignalingSubscription subscription) {
        lock.lock();
        try {
            if (subscription.generation() == generation) {
                generation++;
                arrived.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    int pendingCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    void close() {
        lock.lock();
        try {
            closed = true;
            pending.clear();
            arrived.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
