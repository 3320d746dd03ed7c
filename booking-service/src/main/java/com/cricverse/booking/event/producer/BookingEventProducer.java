package com.cricverse.booking.event.producer;

import com.cricverse.booking.domain.Booking;
import com.cricverse.booking.domain.SeatState;
import com.cricverse.booking.domain.Ticket;
import com.cricverse.booking.event.outbox.OutboxEventService;
import com.cricverse.common.event.BookingEvent;
import com.cricverse.common.event.DomainEvent;
import com.cricverse.common.event.SeatEvent;
import com.cricverse.common.event.TicketEvent;
import com.cricverse.common.event.Topics;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Records booking, seat and ticket events in the outbox. Every method must be called from
 * the transaction that performed the change. Messages are keyed by event id so that all
 * traffic for one match stays ordered on one partition.
 */
@Component
@RequiredArgsConstructor
public class BookingEventProducer {

    private static final String BOOKING = "Booking";
    private static final String TICKET = "Ticket";

    private final OutboxEventService outboxEventService;

    public void publishReserved(Booking booking) {
        List<Long> seatIds = booking.getSeatIds();
        save(BOOKING, booking.getId(), Topics.BOOKING_RESERVED, booking.getEventId(),
                BookingEvent.reserved(booking.getId(), booking.getCustomerId(), booking.getEventId(),
                        seatIds, booking.getTotalAmount(), booking.getHoldExpiresAt()));
        publishSeatsChanged(booking.getEventId(), seatIds, SeatState.FREE, SeatState.RESERVED, booking.getId());
    }

    public void publishConfirmed(Booking booking, List<Ticket> tickets) {
        List<Long> seatIds = booking.getSeatIds();
        save(BOOKING, booking.getId(), Topics.BOOKING_CONFIRMED, booking.getEventId(),
                BookingEvent.confirmed(booking.getId(), booking.getCustomerId(), booking.getEventId(),
                        seatIds, booking.getTotalAmount()));
        publishSeatsChanged(booking.getEventId(), seatIds, SeatState.RESERVED, SeatState.BOOKED, booking.getId());
        for (Ticket ticket : tickets) {
            save(TICKET, ticket.getId(), Topics.TICKET_ISSUED, ticket.getEventId(),
                    TicketEvent.issued(ticket.getId(), ticket.getSeatId(), ticket.getEventId(),
                            ticket.getBookingId(), ticket.getCustomerId(), ticket.getAccessGate()));
        }
    }

    /**
     * @param freedSeatIds seats actually returned to FREE; may be fewer than the booking's
     *                     seats when some were claimed by another booking after expiry
     */
    public void publishReleased(Booking booking, List<Long> freedSeatIds) {
        save(BOOKING, booking.getId(), Topics.BOOKING_RELEASED, booking.getEventId(),
                BookingEvent.released(booking.getId(), booking.getCustomerId(), booking.getEventId(),
                        booking.getSeatIds(), booking.getStatus().name(), booking.getReleaseReason().name()));
        publishSeatsChanged(booking.getEventId(), freedSeatIds, SeatState.RESERVED, SeatState.FREE, booking.getId());
    }

    public void publishTicketCancelled(Ticket ticket) {
        save(TICKET, ticket.getId(), Topics.TICKET_CANCELLED, ticket.getEventId(),
                TicketEvent.cancelled(ticket.getId(), ticket.getSeatId(), ticket.getEventId(),
                        ticket.getBookingId(), ticket.getCustomerId()));
        publishSeatsChanged(ticket.getEventId(), List.of(ticket.getSeatId()),
                SeatState.BOOKED, SeatState.FREE, ticket.getBookingId());
    }

    public void publishTicketTransferred(Ticket retired, Ticket replacement) {
        save(TICKET, retired.getId(), Topics.TICKET_TRANSFERRED, retired.getEventId(),
                TicketEvent.transferred(retired.getId(), retired.getSeatId(), retired.getEventId(),
                        retired.getBookingId(), replacement.getCustomerId(), replacement.getId()));
    }

    public void publishSeatsChanged(Long eventId, List<Long> seatIds, SeatState from, SeatState to, Long bookingId) {
        if (seatIds.isEmpty()) {
            return;
        }
        save("SeatAvailability", eventId, Topics.SEAT_STATUS_CHANGED, eventId,
                SeatEvent.statusChanged(eventId, seatIds, from.name(), to.name(), bookingId));
    }

    private void save(String aggregateType, Long aggregateId, String topic, Long eventId, DomainEvent event) {
        outboxEventService.append(topic, aggregateType, aggregateId, eventId, event);
    }
}
