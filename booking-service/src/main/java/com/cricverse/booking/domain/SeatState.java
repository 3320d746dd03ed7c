package com.cricverse.booking.domain;

/**
 * Per-event occupancy of a seat.
 * Legal moves: FREE to RESERVED, RESERVED to BOOKED, RESERVED to FREE, BOOKED to FREE.
 */
public enum SeatState {
    FREE,
    RESERVED,
    BOOKED;

    public boolean canTransitionTo(SeatState target) {
        return switch (this) {
            case FREE -> target == RESERVED;
            case RESERVED -> target == BOOKED || target == FREE;
            case BOOKED -> target == FREE;
        };
    }

    public void requireTransitionTo(SeatState target) {
        if (!canTransitionTo(target)) {
            throw new IllegalStateException("Illegal seat transition: " + this + " -> " + target);
        }
    }
}
