package com.cricverse.booking.repository;

/**
 * Where a ticket sits, read without loading the entity so the seat row can be locked first.
 */
public record TicketLocation(Long ticketId, Long eventId, Long seatId, Long bookingId) {
}
