package com.cricverse.booking.service;

import com.cricverse.booking.config.BookingProperties;
import com.cricverse.booking.domain.Ticket;
import com.cricverse.booking.event.producer.BookingEventProducer;
import com.cricverse.booking.jooq.SeatAvailabilityJooqRepository;
import com.cricverse.booking.repository.CustomerRepository;
import com.cricverse.booking.repository.TicketLocation;
import com.cricverse.booking.repository.TicketRepository;
import com.cricverse.common.exception.BusinessException;
import com.cricverse.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Lifecycle of issued tickets. Paths that touch the seat take the seat row lock
 * before the ticket row, matching the booking engine's order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TicketService {

    private final TicketRepository ticketRepository;
    private final CustomerRepository customerRepository;
    private final SeatAvailabilityJooqRepository seatLedger;
    private final BookingEventProducer bookingEventProducer;
    private final BookingProperties properties;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Ticket getTicket(Long ticketId, Long customerId) {
        Ticket ticket = ticketRepository.findById(ticketId)
                .orElseThrow(() -> ticketNotFound(ticketId));
        requireOwner(ticket, customerId);
        return ticket;
    }

    @Transactional(readOnly = true)
    public List<Ticket> getCustomerTickets(Long customerId) {
        return ticketRepository.findByCustomerIdOrderByIdDesc(customerId);
    }

    /**
     * Cancels a VALID ticket and returns its seat to FREE. The refund is settled
     * downstream from the TICKET_CANCELLED event.
     */
    @Transactional
    public Ticket cancelTicket(Long ticketId, Long customerId) {
        TicketLocation location = ticketRepository.findLocationById(ticketId)
                .orElseThrow(() -> ticketNotFound(ticketId));

        seatLedger.applyLockTimeout(properties.getLockTimeout());
        seatLedger.lockForUpdate(location.eventId(), List.of(location.seatId()));
        Ticket ticket = lockTicket(ticketId);
        requireOwner(ticket, customerId);

        ticket.cancel();
        int freed = seatLedger.freeBooked(location.eventId(), List.of(location.seatId()),
                location.bookingId(), LocalDateTime.now(clock));
        if (freed != 1) {
            throw new BusinessException(ErrorCode.INVALID_TICKET_STATE,
                    "Seat " + location.seatId() + " of ticket " + ticketId + " is not booked");
        }

        log.info("Ticket cancelled: ticketId={}, seatId={}, eventId={}",
                ticketId, location.seatId(), location.eventId());
        bookingEventProducer.publishTicketCancelled(ticket);
        return ticket;
    }

    /**
     * Retires the holder's ticket and issues a replacement to the recipient. The seat stays BOOKED.
     */
    @Transactional
    public Ticket transferTicket(Long ticketId, Long customerId, Long recipientId) {
        if (customerId.equals(recipientId)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Cannot transfer a ticket to its holder");
        }
        if (!customerRepository.existsById(recipientId)) {
            throw new BusinessException(ErrorCode.CUSTOMER_NOT_FOUND, "Customer not found: " + recipientId);
        }

        Ticket ticket = lockTicket(ticketId);
        requireOwner(ticket, customerId);

        Ticket replacement = ticket.transferTo(recipientId);
        // retire the old ticket before inserting: one live ticket per seat
        ticketRepository.flush();
        replacement = ticketRepository.save(replacement);

        log.info("Ticket transferred: ticketId={}, replacementId={}, from={}, to={}",
                ticketId, replacement.getId(), customerId, recipientId);
        bookingEventProducer.publishTicketTransferred(ticket, replacement);
        return replacement;
    }

    /**
     * Gate scan. Marks a VALID ticket as USED; a second scan fails.
     */
    @Transactional
    public Ticket admit(Long ticketId) {
        Ticket ticket = lockTicket(ticketId);
        ticket.markUsed(LocalDateTime.now(clock));
        log.info("Ticket admitted: ticketId={}, gate={}", ticketId, ticket.getAccessGate());
        return ticket;
    }

    private Ticket lockTicket(Long ticketId) {
        return ticketRepository.findByIdForUpdate(ticketId)
                .orElseThrow(() -> ticketNotFound(ticketId));
    }

    private static void requireOwner(Ticket ticket, Long customerId) {
        if (!ticket.isOwnedBy(customerId)) {
            throw new BusinessException(ErrorCode.FORBIDDEN,
                    "Customer does not hold ticket: " + ticket.getId());
        }
    }

    private static BusinessException ticketNotFound(Long ticketId) {
        return new BusinessException(ErrorCode.TICKET_NOT_FOUND, "Ticket not found: " + ticketId);
    }
}
