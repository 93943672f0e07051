package com.liveroom.servicebackend.room;

import java.util.Locale;

public enum ParticipantRole {
    TUTOR,
    STUDENT;

    /**
     * Lenient parse; unknown or missing values map to {@link #STUDENT}.
     */
    public static ParticipantRole parse(String value) {
        if (value == null || value.isBlank()) {
            return STUDENT;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return STUDENT;
        }
    }
}
