package com.cricverse.booking.dto.response;

import com.cricverse.booking.service.CheckoutOutcome;
import com.cricverse.booking.service.CheckoutResult;

import java.util.List;

public record CheckoutResponse(
        Long bookingId,
        CheckoutOutcome outcome,
        String paymentRef,
        List<TicketResponse.Issued> tickets,
        String message
) {
    public static CheckoutResponse from(CheckoutResult result) {
        return new CheckoutResponse(
                result.bookingId(),
                result.outcome(),
                result.paymentRef(),
                result.tickets().stream().map(TicketResponse.Issued::from).toList(),
                result.message()
        );
    }
}
