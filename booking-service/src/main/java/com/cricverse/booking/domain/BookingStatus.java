package com.cricverse.booking.domain;

public enum BookingStatus {
    PENDING,
    CONFIRMED,
    FAILED,
    CANCELLED;

    public boolean isTerminalRelease() {
        return this == FAILED || this == CANCELLED;
    }
}
