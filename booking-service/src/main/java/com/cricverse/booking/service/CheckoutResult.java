package com.cricverse.booking.service;

import com.cricverse.booking.domain.IssuedTicket;

import java.util.List;

public record CheckoutResult(
        Long bookingId,
        CheckoutOutcome outcome,
        String paymentRef,
        List<IssuedTicket> tickets,
        String message
) {
    public static CheckoutResult confirmed(Long bookingId, String paymentRef, List<IssuedTicket> tickets) {
        return new CheckoutResult(bookingId, CheckoutOutcome.CONFIRMED, paymentRef, tickets, null);
    }

    public static CheckoutResult declined(Long bookingId, String reason) {
        return new CheckoutResult(bookingId, CheckoutOutcome.DECLINED, null, List.of(), reason);
    }

    public static CheckoutResult refunded(Long bookingId, String paymentRef, String reason) {
        return new CheckoutResult(bookingId, CheckoutOutcome.REFUNDED, paymentRef, List.of(), reason);
    }
}
