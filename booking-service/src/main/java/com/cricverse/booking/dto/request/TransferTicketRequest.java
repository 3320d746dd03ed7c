package com.cricverse.booking.dto.request;

import jakarta.validation.constraints.NotNull;

public record TransferTicketRequest(@NotNull Long recipientCustomerId) {
}
