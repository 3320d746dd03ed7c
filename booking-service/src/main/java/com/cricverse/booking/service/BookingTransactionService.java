package com.cricverse.booking.service;

import com.cricverse.booking.config.BookingProperties;
import com.cricverse.booking.domain.Booking;
import com.cricverse.booking.domain.BookingStatus;
import com.cricverse.booking.domain.IssuedTicket;
import com.cricverse.booking.domain.ReleaseReason;
import com.cricverse.booking.domain.Seat;
import com.cricverse.booking.domain.Ticket;
import com.cricverse.booking.event.producer.BookingEventProducer;
import com.cricverse.booking.exception.SeatUnavailableException;
import com.cricverse.booking.jooq.LockedSeat;
import com.cricverse.booking.jooq.SeatAvailabilityJooqRepository;
import com.cricverse.booking.repository.BookingRepository;
import com.cricverse.booking.repository.SeatRepository;
import com.cricverse.booking.repository.TicketRepository;
import com.cricverse.common.exception.BusinessException;
import com.cricverse.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Transactional core of the booking engine. Kept apart from BookingService so the
 * {@code @Transactional} proxy is always crossed.
 *
 * <p>Lock order in every transaction: seat_availability rows in ascending seat id,
 * then the booking row. Any path that touches both follows it, so overlapping
 * requests queue instead of deadlocking.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingTransactionService {

    private final BookingRepository bookingRepository;
    private final TicketRepository ticketRepository;
    private final SeatRepository seatRepository;
    private final SeatAvailabilityJooqRepository seatLedger;
    private final BookingEventProducer bookingEventProducer;
    private final BookingProperties properties;
    private final Clock clock;

    /**
     * Claims every requested seat for a new PENDING booking, or none of them.
     *
     * @throws SeatUnavailableException if any seat is reserved (unexpired) or booked
     * @throws BusinessException        SEAT_NOT_IN_EVENT if a seat is not on sale for the event
     */
    @Transactional
    public Booking reserveSeats(Long customerId, Long eventId, Collection<Long> seatIds) {
        List<Long> ordered = List.copyOf(new TreeSet<>(seatIds));
        LocalDateTime now = LocalDateTime.now(clock);

        seatLedger.applyLockTimeout(properties.getLockTimeout());
        List<LockedSeat> locked = seatLedger.lockForUpdate(eventId, ordered);
        requireAllPresent(eventId, ordered, locked);

        List<Long> blocking = locked.stream()
                .filter(seat -> !seat.isClaimableAt(now))
                .map(LockedSeat::seatId)
                .toList();
        if (!blocking.isEmpty()) {
            throw unavailable(blocking);
        }

        Map<Long, BigDecimal> prices = seatLedger.findBasePrices(ordered);
        Booking booking = Booking.builder()
                .customerId(customerId)
                .eventId(eventId)
                .holdExpiresAt(now.plus(properties.getReservationWindow()))
                .build();
        for (Long seatId : ordered) {
            booking.addSeat(seatId, prices.get(seatId));
        }
        booking = bookingRepository.saveAndFlush(booking);

        int updated = seatLedger.reserve(eventId, ordered, booking.getId(), customerId,
                booking.getHoldExpiresAt(), now);
        if (updated != ordered.size()) {
            // rows are locked, so this only happens if the ledger changed under us
            throw new SeatUnavailableException(ordered,
                    "Failed to reserve all seats. Expected=" + ordered.size() + ", updated=" + updated);
        }

        log.info("Seats reserved: bookingId={}, customerId={}, eventId={}, seatIds={}, expiresAt={}",
                booking.getId(), customerId, eventId, ordered, booking.getHoldExpiresAt());
        bookingEventProducer.publishReserved(booking);
        return booking;
    }

    /**
     * Moves a PENDING booking's seats to BOOKED and issues one ticket per seat.
     * Confirming an already CONFIRMED booking returns its tickets without side effects.
     *
     * @throws BusinessException INVALID_BOOKING_STATE if the booking was released or lost its seats
     */
    @Transactional
    public List<IssuedTicket> confirmBooking(Long bookingId, String paymentRef) {
        Long eventId = findEventId(bookingId);
        List<Long> seatIds = bookingRepository.findSeatIdsByBookingId(bookingId);
        LocalDateTime now = LocalDateTime.now(clock);

        seatLedger.applyLockTimeout(properties.getLockTimeout());
        List<LockedSeat> locked = seatLedger.lockForUpdate(eventId, seatIds);
        Booking booking = lockBooking(bookingId);

        if (booking.getStatus() == BookingStatus.CONFIRMED) {
            log.info("Booking already confirmed: bookingId={}", bookingId);
            return ticketRepository.findByBookingIdOrderByIdAsc(bookingId).stream()
                    .map(IssuedTicket::from)
                    .toList();
        }
        if (!booking.isPending()) {
            throw new BusinessException(ErrorCode.INVALID_BOOKING_STATE,
                    "Cannot confirm booking " + bookingId + ": current status=" + booking.getStatus());
        }

        Set<Long> held = locked.stream()
                .filter(seat -> seat.isReservedBy(bookingId))
                .map(LockedSeat::seatId)
                .collect(Collectors.toSet());
        List<Long> lost = seatIds.stream().filter(id -> !held.contains(id)).toList();
        if (!lost.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_BOOKING_STATE,
                    "Reservation of booking " + bookingId + " no longer holds seats " + lost);
        }

        int updated = seatLedger.book(eventId, seatIds, bookingId, now);
        if (updated != seatIds.size()) {
            throw new BusinessException(ErrorCode.INVALID_BOOKING_STATE,
                    "Failed to book all seats. Expected=" + seatIds.size() + ", updated=" + updated);
        }
        booking.confirm(paymentRef);

        Map<Long, Seat> seats = seatRepository.findAllById(seatIds).stream()
                .collect(Collectors.toMap(Seat::getId, Function.identity()));
        List<Ticket> tickets = seatIds.stream()
                .map(seatId -> Ticket.builder()
                        .bookingId(bookingId)
                        .eventId(eventId)
                        .seatId(seatId)
                        .customerId(booking.getCustomerId())
                        .accessGate(seats.containsKey(seatId)
                                ? seats.get(seatId).accessGate()
                                : Seat.accessGate(null))
                        .build())
                .toList();
        tickets = ticketRepository.saveAll(tickets);

        log.info("Booking confirmed: bookingId={}, paymentRef={}, tickets={}",
                bookingId, paymentRef, tickets.size());
        bookingEventProducer.publishConfirmed(booking, tickets);
        return tickets.stream().map(IssuedTicket::from).toList();
    }

    /**
     * Ends a PENDING booking and frees the seats it still holds.
     * Releasing an already FAILED or CANCELLED booking is a no-op.
     *
     * @throws BusinessException INVALID_BOOKING_STATE if the booking is CONFIRMED, or if an
     *                           EXPIRED release targets a booking whose window has not passed
     */
    @Transactional
    public Booking releaseBooking(Long bookingId, ReleaseReason reason) {
        Long eventId = findEventId(bookingId);
        List<Long> seatIds = bookingRepository.findSeatIdsByBookingId(bookingId);
        LocalDateTime now = LocalDateTime.now(clock);

        seatLedger.applyLockTimeout(properties.getLockTimeout());
        List<LockedSeat> locked = seatLedger.lockForUpdate(eventId, seatIds);
        Booking booking = lockBooking(bookingId);

        if (booking.getStatus().isTerminalRelease()) {
            log.debug("Booking already released: bookingId={}, status={}", bookingId, booking.getStatus());
            return booking;
        }
        if (reason == ReleaseReason.EXPIRED && booking.isPending() && !booking.isExpired(now)) {
            throw new BusinessException(ErrorCode.INVALID_BOOKING_STATE,
                    "Reservation of booking " + bookingId + " has not expired yet");
        }
        booking.release(reason);

        List<Long> stillHeld = locked.stream()
                .filter(seat -> seat.isReservedBy(bookingId))
                .map(LockedSeat::seatId)
                .toList();
        int freed = seatLedger.freeReserved(eventId, stillHeld, bookingId, now);

        log.info("Booking released: bookingId={}, reason={}, status={}, seatsFreed={}/{}",
                bookingId, reason, booking.getStatus(), freed, seatIds.size());
        bookingEventProducer.publishReleased(booking, stillHeld);
        return booking;
    }

    private Long findEventId(Long bookingId) {
        return bookingRepository.findEventIdById(bookingId)
                .orElseThrow(() -> bookingNotFound(bookingId));
    }

    private Booking lockBooking(Long bookingId) {
        return bookingRepository.findByIdForUpdate(bookingId)
                .orElseThrow(() -> bookingNotFound(bookingId));
    }

    private void requireAllPresent(Long eventId, List<Long> requested, List<LockedSeat> locked) {
        if (locked.size() == requested.size()) {
            return;
        }
        Set<Long> found = locked.stream().map(LockedSeat::seatId).collect(Collectors.toSet());
        List<Long> missing = requested.stream().filter(id -> !found.contains(id)).toList();
        throw new BusinessException(ErrorCode.SEAT_NOT_IN_EVENT,
                "Seats " + missing + " are not on sale for event " + eventId);
    }

    private SeatUnavailableException unavailable(List<Long> seatIds) {
        Map<Long, String> labels = seatLedger.findSeatLabels(seatIds);
        String names = seatIds.stream()
                .map(id -> labels.getOrDefault(id, String.valueOf(id)))
                .collect(Collectors.joining(", "));
        String message = seatIds.size() == 1
                ? "Seat " + names + " is no longer available"
                : "Seats " + names + " are no longer available";
        return new SeatUnavailableException(seatIds, message);
    }

    private static BusinessException bookingNotFound(Long bookingId) {
        return new BusinessException(ErrorCode.BOOKING_NOT_FOUND, "Booking not found: " + bookingId);
    }
}
