package com.cricverse.booking.dto.response;

import com.cricverse.booking.domain.IssuedTicket;
import com.cricverse.booking.domain.Ticket;
import com.cricverse.booking.domain.TicketStatus;

import java.time.LocalDateTime;

public record TicketResponse(
        Long ticketId,
        Long bookingId,
        Long eventId,
        Long seatId,
        Long customerId,
        TicketStatus status,
        String accessGate,
        LocalDateTime usedAt
) {
    public static TicketResponse from(Ticket ticket) {
        return new TicketResponse(
                ticket.getId(),
                ticket.getBookingId(),
                ticket.getEventId(),
                ticket.getSeatId(),
                ticket.getCustomerId(),
                ticket.getStatus(),
                ticket.getAccessGate(),
                ticket.getUsedAt()
        );
    }

    public record Issued(Long ticketId, Long seatId, Long eventId, Long bookingId) {
        public static Issued from(IssuedTicket ticket) {
            return new Issued(ticket.ticketId(), ticket.seatId(), ticket.eventId(), ticket.bookingId());
        }
    }
}
