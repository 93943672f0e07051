package com.liveroom.servicebackend.signaling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-room relay of signaling messages between participants.
 *
 * Delivery is ordered per sender and recipient. A sender retrying after a transient
 * failure may resend a message with the same sequence number; the recipient's mailbox
 * accepts it at most once.
 */
public class SignalingChannel {
    private static final Logger log = LoggerFactory.getLogger(SignalingChannel.class);

    private final String roomId;

    // participantId -> inbound mailbox
    private final Map<String, Mailbox> mailboxes = new ConcurrentHashMap<>();
    private volatile boolean shutdown;

    public SignalingChannel(String roomId) {
        this.roomId = roomId;
    }

    public String roomId() {
        return roomId;
    }

    public void open(String participantId) {
        if (shutdown) {
            throw new ChannelClosedException("Signaling channel for room " + roomId + " is closed");
        }
        mailboxes.computeIfAbsent(participantId, Mailbox::new);
        log.debug("Signaling endpoint opened: room={}, participant={}", roomId, participantId);
    }

    /**
     * Tears down the participant's endpoint. Later sends to or from it fail until the
     * participant opens a new endpoint, whose sequence numbers start afresh.
     */
    public void close(String participantId) {
        Mailbox mailbox = mailboxes.remove(participantId);
        if (mailbox != null) {
            mailbox.close();
            mailboxes.values().forEach(other -> other.forgetSender(mailbox));
            log.debug("Signaling endpoint closed: room={}, participant={}", roomId, participantId);
        }
    }

    public boolean isOpen(String participantId) {
        return !shutdown && mailboxes.containsKey(participantId);
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * Delivers a message to its recipient, or to every other open endpoint when it is a
     * broadcast.
     *
     * @return false if the recipient had already accepted this sequence number
     * @throws ChannelClosedException if the channel, the sender or the recipient is closed
     */
    public boolean send(SignalingMessage message) {
        if (shutdown) {
            throw new ChannelClosedException("Signaling channel for room " + roomId + " is closed");
        }
        Mailbox sender = mailboxes.get(message.from());
        if (sender == null) {
            throw new ChannelClosedException("Sender " + message.from() + " is not connected to room " + roomId);
        }

        if (message.isBroadcast()) {
            return broadcast(message, sender);
        }

        Mailbox target = mailboxes.get(message.to());
        if (target == null) {
            throw new ChannelClosedException("Recipient " + message.to() + " is not connected to room " + roomId);
        }
        boolean accepted = target.offer(message, sender);
        if (accepted) {
            log.debug("Relayed {} #{} {} -> {} in room {}",
                    message.type().wireName(), message.seq(), message.from(), message.to(), roomId);
        } else {
            log.debug("Dropped duplicate {} #{} from {} to {}",
                    message.type().wireName(), message.seq(), message.from(), message.to());
        }
        return accepted;
    }

    private boolean broadcast(SignalingMessage message, Mailbox sender) {
        int recipients = 0;
        int accepted = 0;
        for (Mailbox mailbox : mailboxes.values()) {
            if (mailbox.owner().equals(message.from())) {
                continue;
            }
            recipients++;
            try {
                if (mailbox.offer(message, sender)) {
                    accepted++;
                }
            } catch (ChannelClosedException e) {
                // recipient left concurrently
                log.debug("Skipping broadcast to departed participant {}", mailbox.owner());
            }
        }
        log.debug("Broadcast {} #{} from {} to {}/{} participants in room {}",
                message.type().wireName(), message.seq(), message.from(), accepted, recipients, roomId);
        return recipients == 0 || accepted > 0;
    }

    /**
     * Opens a subscription for the participant's inbound messages, replacing any
     * previous one. Delivery resumes at the first unacknowledged message.
     */
    public SignalingSubscription subscribe(String participantId) {
        Mailbox mailbox = mailboxes.get(participantId);
        if (shutdown || mailbox == null) {
            throw new ChannelClosedException("Participant " + participantId + " is not connected to room " + roomId);
        }
        return mailbox.subscribe();
    }

    public int pendingCount(String participantId) {
        Mailbox mailbox = mailboxes.get(participantId);
        return mailbox != null ? mailbox.pendingCount() : 0;
    }

    public List<String> participants() {
        return List.copyOf(mailboxes.keySet());
    }

    /**
     * Closes every endpoint. Idempotent.
     */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        mailboxes.values().forEach(Mailbox::close);
        mailboxes.clear();
        log.info("Signaling channel for room {} shut down", roomId);
    }
}
