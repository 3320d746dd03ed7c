package com.cricverse.booking.domain;

public enum TicketStatus {
    VALID,
    USED,
    CANCELLED,
    TRANSFERRED
}
