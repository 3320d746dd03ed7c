package com.cricverse.booking.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ConfirmBookingRequest(
        @NotBlank @Size(max = 64) String paymentRef
) {
}
