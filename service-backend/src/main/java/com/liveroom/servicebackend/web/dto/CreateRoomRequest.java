package com.liveroom.servicebackend.web.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Schedules a room ahead of its first join. Capacity defaults to the configured room size.
 */
public record CreateRoomRequest(
        @NotBlank(message = "Room id is required") String roomId,

        @Positive(message = "Capacity must be positive") @Max(value = 16, message = "Capacity must not exceed 16") Integer capacity) {
}
