package com.cricverse.booking.jooq;

import com.cricverse.booking.domain.SeatState;

import java.time.LocalDateTime;

/**
 * Snapshot of a seat_availability row read under FOR UPDATE.
 */
public record LockedSeat(Long seatId, SeatState state, Long bookingId,
                         Long holderCustomerId, LocalDateTime expiresAt) {

    /** FREE, or RESERVED with an expiry strictly in the past. */
    public boolean isClaimableAt(LocalDateTime now) {
        return state == SeatState.FREE
                || (state == SeatState.RESERVED && expiresAt != null && expiresAt.isBefore(now));
    }

    public boolean isReservedBy(Long bookingId) {
        return state == SeatState.RESERVED && bookingId.equals(this.bookingId);
    }

    public boolean isBookedBy(Long bookingId) {
        return state == SeatState.BOOKED && bookingId.equals(this.bookingId);
    }
}
