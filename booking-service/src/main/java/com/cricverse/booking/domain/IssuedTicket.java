package com.cricverse.booking.domain;

/**
 * Output of a successful confirmation, consumed by downstream QR and artifact generation.
 */
public record IssuedTicket(Long ticketId, Long seatId, Long eventId, Long bookingId) {

    public static IssuedTicket from(Ticket ticket) {
        return new IssuedTicket(ticket.getId(), ticket.getSeatId(), ticket.getEventId(), ticket.getBookingId());
    }
}
