package com.liveroom.servicebackend.signaling;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * JSON wire format for signaling messages:
 * {@code {type: offer|answer|candidate|bye|media-state, seq, from, to?, payload}}.
 */
public class SignalingCodec {
    private final ObjectMapper objectMapper;

    public SignalingCodec() {
        this(new ObjectMapper());
    }

    public SignalingCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String encode(SignalingMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode signaling message", e);
        }
    }

    /**
     * @throws IllegalArgumentException if the text is not a valid signaling message
     */
    public SignalingMessage decode(String json) {
        SignalingMessage message;
        try {
            message = objectMapper.readValue(json, SignalingMessage.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed signaling message: " + e.getOriginalMessage(), e);
        }
        if (message == null) {
            throw new IllegalArgumentException("Empty signaling message");
        }
        validate(message);
        return message;
    }

    public String encodeError(String message) {
        return encodeFrame(Map.of("type", "error", "message", message));
    }

    /**
     * Encodes a control frame (connection notices, room events) sent alongside signaling messages.
     */
    public String encodeFrame(Object frame) {
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode frame", e);
        }
    }

    private static void validate(SignalingMessage message) {
        SignalingPayload payload = message.payload();
        switch (message.type()) {
            case OFFER:
            case ANSWER:
                if (payload == null || payload.sdp() == null || payload.sdp().isBlank()) {
                    throw new IllegalArgumentException(message.type().wireName() + " requires payload.sdp");
                }
                break;
            case CANDIDATE:
                if (payload == null || payload.candidate() == null || payload.sdpMLineIndex() == null) {
                    throw new IllegalArgumentException("candidate requires payload.candidate and payload.sdpMLineIndex");
                }
                break;
            case MEDIA_STATE:
                if (payload == null || !payload.isMediaState()) {
                    throw new IllegalArgumentException("media-state requires payload.media (video, audio or screen) and payload.enabled");
                }
                break;
            default:
                break;
        }
    }
}
