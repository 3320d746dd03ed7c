package com.cricverse.booking.service;

import com.cricverse.booking.config.BookingProperties;
import com.cricverse.booking.domain.BookingStatus;
import com.cricverse.booking.domain.ReleaseReason;
import com.cricverse.booking.domain.SeatState;
import com.cricverse.booking.event.producer.BookingEventProducer;
import com.cricverse.booking.jooq.LockedSeat;
import com.cricverse.booking.jooq.SeatAvailabilityJooqRepository;
import com.cricverse.booking.jooq.SeatRef;
import com.cricverse.booking.repository.BookingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Cross-checks the seat ledger against bookings and tickets.
 * Orphaned reservations are repaired; booked/ticket mismatches are only reported.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DataReconciliationService {

    private static final int EXPIRED_BATCH = 200;

    private final SeatAvailabilityJooqRepository seatLedger;
    private final BookingRepository bookingRepository;
    private final BookingTransactionService transactionService;
    private final BookingEventProducer bookingEventProducer;
    private final BookingProperties properties;
    private final Clock clock;

    /**
     * Check 1: RESERVED seats whose booking is not PENDING (or is gone) are returned to FREE.
     */
    @Transactional
    public int reconcileOrphanedReservations() {
        List<SeatRef> orphans = seatLedger.findReservationsWithoutPendingBooking();
        if (orphans.isEmpty()) return 0;

        seatLedger.applyLockTimeout(properties.getLockTimeout());
        LocalDateTime now = LocalDateTime.now(clock);

        // one lock call per event keeps seat locks in ascending seat id order
        Map<Long, Map<Long, Long>> orphanHolderBySeat = orphans.stream()
                .filter(ref -> {
                    if (ref.bookingId() == null) {
                        log.warn("RECONCILE: RESERVED seat without booking: eventId={}, seatId={}",
                                ref.eventId(), ref.seatId());
                        return false;
                    }
                    return true;
                })
                .collect(Collectors.groupingBy(SeatRef::eventId, TreeMap::new,
                        Collectors.toMap(SeatRef::seatId, SeatRef::bookingId, (a, b) -> a)));

        int released = 0;
        for (var perEvent : orphanHolderBySeat.entrySet()) {
            Long eventId = perEvent.getKey();
            Map<Long, Long> holderBySeat = perEvent.getValue();

            Map<Long, List<Long>> stillOrphanedByBooking = seatLedger
                    .lockForUpdate(eventId, List.copyOf(new TreeSet<>(holderBySeat.keySet()))).stream()
                    .filter(seat -> seat.isReservedBy(holderBySeat.get(seat.seatId())))
                    .collect(Collectors.groupingBy(LockedSeat::bookingId, TreeMap::new,
                            Collectors.mapping(LockedSeat::seatId, Collectors.toList())));

            for (var perBooking : stillOrphanedByBooking.entrySet()) {
                Long bookingId = perBooking.getKey();
                List<Long> stillOrphaned = perBooking.getValue();
                int freed = seatLedger.freeReserved(eventId, stillOrphaned, bookingId, now);
                if (freed > 0) {
                    log.warn("RECONCILE: Freed {} orphaned reservations: eventId={}, bookingId={}, seatIds={}",
                            freed, eventId, bookingId, stillOrphaned);
                    bookingEventProducer.publishSeatsChanged(eventId, stillOrphaned,
                            SeatState.RESERVED, SeatState.FREE, bookingId);
                    released += freed;
                }
            }
        }

        if (released > 0) {
            log.info("RECONCILE: Released {} orphaned reservations", released);
        }
        return released;
    }

    /**
     * Check 2: every BOOKED seat must have exactly one live ticket and vice versa.
     */
    @Transactional(readOnly = true)
    public int detectTicketSeatMismatch() {
        List<SeatRef> bookedWithoutTicket = seatLedger.findBookedSeatsWithoutLiveTicket();
        List<SeatRef> ticketsWithoutSeat = seatLedger.findLiveTicketsWithoutBookedSeat();

        for (SeatRef ref : bookedWithoutTicket) {
            log.warn("RECONCILE: BOOKED seat has no live ticket: eventId={}, seatId={}, bookingId={}",
                    ref.eventId(), ref.seatId(), ref.bookingId());
        }
        for (SeatRef ref : ticketsWithoutSeat) {
            log.warn("RECONCILE: Live ticket on a seat that is not BOOKED: eventId={}, seatId={}, ticketId={}",
                    ref.eventId(), ref.seatId(), ref.bookingId());
        }

        int mismatches = bookedWithoutTicket.size() + ticketsWithoutSeat.size();
        if (mismatches > 0) {
            log.warn("RECONCILE: Found {} ticket-seat mismatches", mismatches);
        }
        return mismatches;
    }

    /**
     * Check 3: expired PENDING bookings the sweep has not reached yet.
     * Each release runs in its own transaction.
     */
    public int reconcileExpiredPendingBookings() {
        List<Long> expired = bookingRepository.findIdsByStatusAndHoldExpiresAtBefore(
                BookingStatus.PENDING, LocalDateTime.now(clock), PageRequest.of(0, EXPIRED_BATCH));

        int released = 0;
        for (Long bookingId : expired) {
            try {
                transactionService.releaseBooking(bookingId, ReleaseReason.EXPIRED);
                log.warn("RECONCILE: Released expired booking {}", bookingId);
                released++;
            } catch (Exception e) {
                log.error("RECONCILE: Failed to release expired booking {}", bookingId, e);
            }
        }

        if (released > 0) {
            log.info("RECONCILE: Released {} expired PENDING bookings", released);
        }
        return released;
    }
}
