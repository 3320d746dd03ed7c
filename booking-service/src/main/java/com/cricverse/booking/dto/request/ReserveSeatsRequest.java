package com.cricverse.booking.dto.request;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record ReserveSeatsRequest(
        @NotNull Long eventId,
        @NotEmpty List<@NotNull Long> seatIds
) {
}
