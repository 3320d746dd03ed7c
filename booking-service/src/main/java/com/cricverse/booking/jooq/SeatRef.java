package com.cricverse.booking.jooq;

/**
 * (event, seat) pair with the booking holding it, if any. Used by reconciliation reports.
 */
public record SeatRef(Long eventId, Long seatId, Long bookingId) {
}
