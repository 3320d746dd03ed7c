package com.cricverse.common.response;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INVALID_INPUT(400, "C001", "Invalid input"),
    RESOURCE_NOT_FOUND(404, "C002", "Resource not found"),
    INTERNAL_ERROR(500, "C003", "Internal server error"),
    FORBIDDEN(403, "C005", "Forbidden"),
    PERSISTENCE_FAILURE(503, "C006", "Storage temporarily unavailable, please retry"),

    // Catalog
    CUSTOMER_NOT_FOUND(404, "E001", "Customer not found"),
    EVENT_NOT_FOUND(404, "E002", "Event not found"),
    SEAT_NOT_IN_EVENT(400, "E003", "Seat does not belong to the event"),

    // Booking
    SEAT_UNAVAILABLE(409, "B001", "Seat is no longer available"),
    BOOKING_NOT_FOUND(404, "B003", "Booking not found"),
    INVALID_BOOKING_STATE(409, "B004", "Booking is not in a valid state for this operation"),

    // Payment
    PAYMENT_DECLINED(402, "P001", "Payment was declined"),
    PAYMENT_UNAVAILABLE(503, "P004", "Payment gateway temporarily unavailable"),

    // Ticket
    TICKET_NOT_FOUND(404, "T001", "Ticket not found"),
    INVALID_TICKET_STATE(409, "T002", "Ticket is not in a valid state for this operation");

    private final int status;
    private final String code;
    private final String message;
}
