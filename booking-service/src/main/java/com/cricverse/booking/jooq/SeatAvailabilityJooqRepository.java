package com.cricverse.booking.jooq;

import com.cricverse.booking.domain.SeatState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.Record;
import org.jooq.impl.DSL;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import static com.cricverse.booking.jooq.LedgerTables.BOOKINGS;
import static com.cricverse.booking.jooq.LedgerTables.SEATS;
import static com.cricverse.booking.jooq.LedgerTables.SEAT_AVAILABILITY;
import static com.cricverse.booking.jooq.LedgerTables.TICKETS;

/**
 * Seat ledger: the only writer of seat_availability.
 * Locking and transition methods MUST run inside the caller's transaction; every
 * transition is a guarded UPDATE whose WHERE clause names the legal source state,
 * so callers compare the returned row count with the number of seats they expected to move.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SeatAvailabilityJooqRepository {

    private final DSLContext dsl;

    /**
     * Bounds how long the current transaction waits for a row lock.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void applyLockTimeout(Duration timeout) {
        long millis = Math.max(1L, timeout.toMillis());
        switch (dsl.dialect().family()) {
            case POSTGRES -> dsl.execute("SET LOCAL lock_timeout = '" + millis + "ms'");
            case H2 -> dsl.execute("SET LOCK_TIMEOUT " + millis);
            default -> log.debug("Lock timeout not supported for dialect={}", dsl.dialect());
        }
    }

    /**
     * SELECT ... FOR UPDATE over exactly the requested rows, in ascending seat id order
     * so that overlapping multi-seat requests always queue in the same order.
     * Seats without a row for the event are simply absent from the result.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<LockedSeat> lockForUpdate(Long eventId, Collection<Long> seatIds) {
        if (seatIds == null || seatIds.isEmpty()) {
            return List.of();
        }
        TreeSet<Long> ordered = new TreeSet<>(seatIds);
        return dsl.select(
                        SEAT_AVAILABILITY.SEAT_ID,
                        SEAT_AVAILABILITY.STATE,
                        SEAT_AVAILABILITY.BOOKING_ID,
                        SEAT_AVAILABILITY.HOLDER_CUSTOMER_ID,
                        SEAT_AVAILABILITY.EXPIRES_AT)
                .from(SEAT_AVAILABILITY.TABLE)
                .where(SEAT_AVAILABILITY.EVENT_ID.eq(eventId))
                .and(SEAT_AVAILABILITY.SEAT_ID.in(ordered))
                .orderBy(SEAT_AVAILABILITY.SEAT_ID.asc())
                .forUpdate()
                .fetch(r -> new LockedSeat(
                        r.get(SEAT_AVAILABILITY.SEAT_ID),
                        SeatState.valueOf(r.get(SEAT_AVAILABILITY.STATE)),
                        r.get(SEAT_AVAILABILITY.BOOKING_ID),
                        r.get(SEAT_AVAILABILITY.HOLDER_CUSTOMER_ID),
                        r.get(SEAT_AVAILABILITY.EXPIRES_AT)));
    }

    /**
     * FREE (or RESERVED but expired) to RESERVED for the given booking.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int reserve(Long eventId, Collection<Long> seatIds, Long bookingId, Long customerId,
                       LocalDateTime expiresAt, LocalDateTime now) {
        SeatState.FREE.requireTransitionTo(SeatState.RESERVED);
        if (seatIds.isEmpty()) {
            return 0;
        }
        Condition claimable = SEAT_AVAILABILITY.STATE.eq(SeatState.FREE.name())
                .or(SEAT_AVAILABILITY.STATE.eq(SeatState.RESERVED.name())
                        .and(SEAT_AVAILABILITY.EXPIRES_AT.lt(now)));
        return dsl.update(SEAT_AVAILABILITY.TABLE)
                .set(SEAT_AVAILABILITY.STATE, SeatState.RESERVED.name())
                .set(SEAT_AVAILABILITY.BOOKING_ID, bookingId)
                .set(SEAT_AVAILABILITY.HOLDER_CUSTOMER_ID, customerId)
                .set(SEAT_AVAILABILITY.EXPIRES_AT, expiresAt)
                .set(SEAT_AVAILABILITY.VERSION, SEAT_AVAILABILITY.VERSION.plus(1))
                .set(SEAT_AVAILABILITY.UPDATED_AT, now)
                .where(SEAT_AVAILABILITY.EVENT_ID.eq(eventId))
                .and(SEAT_AVAILABILITY.SEAT_ID.in(seatIds))
                .and(claimable)
                .execute();
    }

    /**
     * RESERVED to BOOKED, only for rows still held by the booking.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int book(Long eventId, Collection<Long> seatIds, Long bookingId, LocalDateTime now) {
        return transition(eventId, seatIds, bookingId, SeatState.RESERVED, SeatState.BOOKED, now);
    }

    /**
     * RESERVED to FREE, only for rows still held by the booking. Rows already
     * claimed by another booking after expiry are left untouched.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int freeReserved(Long eventId, Collection<Long> seatIds, Long bookingId, LocalDateTime now) {
        return transition(eventId, seatIds, bookingId, SeatState.RESERVED, SeatState.FREE, now);
    }

    /**
     * BOOKED to FREE (cancellation / refund of an issued ticket).
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int freeBooked(Long eventId, Collection<Long> seatIds, Long bookingId, LocalDateTime now) {
        return transition(eventId, seatIds, bookingId, SeatState.BOOKED, SeatState.FREE, now);
    }

    private int transition(Long eventId, Collection<Long> seatIds, Long bookingId,
                           SeatState from, SeatState to, LocalDateTime now) {
        from.requireTransitionTo(to);
        if (seatIds == null || seatIds.isEmpty()) {
            return 0;
        }
        var update = dsl.update(SEAT_AVAILABILITY.TABLE)
                .set(SEAT_AVAILABILITY.STATE, to.name())
                .set(SEAT_AVAILABILITY.EXPIRES_AT, (LocalDateTime) null)
                .set(SEAT_AVAILABILITY.VERSION, SEAT_AVAILABILITY.VERSION.plus(1))
                .set(SEAT_AVAILABILITY.UPDATED_AT, now);
        if (to == SeatState.FREE) {
            update = update
                    .set(SEAT_AVAILABILITY.BOOKING_ID, (Long) null)
                    .set(SEAT_AVAILABILITY.HOLDER_CUSTOMER_ID, (Long) null);
        }
        return update
                .where(SEAT_AVAILABILITY.EVENT_ID.eq(eventId))
                .and(SEAT_AVAILABILITY.SEAT_ID.in(seatIds))
                .and(SEAT_AVAILABILITY.STATE.eq(from.name()))
                .and(SEAT_AVAILABILITY.BOOKING_ID.eq(bookingId))
                .execute();
    }

    /**
     * Seat map of an event ordered by section, row and seat number.
     */
    public List<SeatMapRow> findSeatMap(Long eventId, LocalDateTime now) {
        return dsl.select(
                        SEATS.ID, SEATS.SECTION, SEATS.ROW_LABEL, SEATS.SEAT_NUMBER,
                        SEATS.SEAT_TYPE, SEATS.BASE_PRICE,
                        SEAT_AVAILABILITY.STATE, SEAT_AVAILABILITY.EXPIRES_AT)
                .from(SEAT_AVAILABILITY.TABLE)
                .join(SEATS.TABLE).on(SEATS.ID.eq(SEAT_AVAILABILITY.SEAT_ID))
                .where(SEAT_AVAILABILITY.EVENT_ID.eq(eventId))
                .orderBy(SEATS.SECTION, SEATS.ROW_LABEL, SEATS.SEAT_NUMBER)
                .fetch(r -> new SeatMapRow(
                        r.get(SEATS.ID),
                        r.get(SEATS.SECTION),
                        r.get(SEATS.ROW_LABEL),
                        r.get(SEATS.SEAT_NUMBER),
                        r.get(SEATS.SEAT_TYPE),
                        r.get(SEATS.BASE_PRICE),
                        effectiveState(r.get(SEAT_AVAILABILITY.STATE), r.get(SEAT_AVAILABILITY.EXPIRES_AT), now)));
    }

    /**
     * Base prices read from the seat catalogue without taking any lock.
     */
    public Map<Long, BigDecimal> findBasePrices(Collection<Long> seatIds) {
        Map<Long, BigDecimal> prices = new LinkedHashMap<>();
        if (seatIds == null || seatIds.isEmpty()) {
            return prices;
        }
        dsl.select(SEATS.ID, SEATS.BASE_PRICE)
                .from(SEATS.TABLE)
                .where(SEATS.ID.in(seatIds))
                .orderBy(SEATS.ID.asc())
                .fetch()
                .forEach(r -> prices.put(r.get(SEATS.ID), r.get(SEATS.BASE_PRICE)));
        return prices;
    }

    /**
     * Seat labels (section-row-number) for conflict messages.
     */
    public Map<Long, String> findSeatLabels(Collection<Long> seatIds) {
        Map<Long, String> labels = new LinkedHashMap<>();
        if (seatIds == null || seatIds.isEmpty()) {
            return labels;
        }
        dsl.select(SEATS.ID, SEATS.SECTION, SEATS.ROW_LABEL, SEATS.SEAT_NUMBER)
                .from(SEATS.TABLE)
                .where(SEATS.ID.in(seatIds))
                .orderBy(SEATS.ID.asc())
                .fetch()
                .forEach(r -> labels.put(r.get(SEATS.ID),
                        r.get(SEATS.SECTION) + "-" + r.get(SEATS.ROW_LABEL) + "-" + r.get(SEATS.SEAT_NUMBER)));
        return labels;
    }

    /**
     * Bookings holding at least one reservation whose expiry lies strictly before {@code now}.
     */
    public List<Long> findBookingIdsWithExpiredReservations(LocalDateTime now, int limit) {
        return dsl.selectDistinct(SEAT_AVAILABILITY.BOOKING_ID)
                .from(SEAT_AVAILABILITY.TABLE)
                .where(SEAT_AVAILABILITY.STATE.eq(SeatState.RESERVED.name()))
                .and(SEAT_AVAILABILITY.EXPIRES_AT.lt(now))
                .and(SEAT_AVAILABILITY.BOOKING_ID.isNotNull())
                .orderBy(SEAT_AVAILABILITY.BOOKING_ID.asc())
                .limit(limit)
                .fetch(SEAT_AVAILABILITY.BOOKING_ID);
    }

    /**
     * Inserts a FREE row for every seat of the stadium that has none for the event yet.
     */
    @Transactional
    public int materializeEvent(Long eventId, Long stadiumId, LocalDateTime now) {
        return dsl.insertInto(SEAT_AVAILABILITY.TABLE,
                        SEAT_AVAILABILITY.SEAT_ID,
                        SEAT_AVAILABILITY.EVENT_ID,
                        SEAT_AVAILABILITY.STATE,
                        SEAT_AVAILABILITY.VERSION,
                        SEAT_AVAILABILITY.UPDATED_AT)
                .select(dsl.select(
                                SEATS.ID,
                                DSL.val(eventId),
                                DSL.val(SeatState.FREE.name()),
                                DSL.val(0L),
                                DSL.val(now))
                        .from(SEATS.TABLE)
                        .where(SEATS.STADIUM_ID.eq(stadiumId))
                        .andNotExists(dsl.selectOne()
                                .from(SEAT_AVAILABILITY.TABLE)
                                .where(SEAT_AVAILABILITY.SEAT_ID.eq(SEATS.ID))
                                .and(SEAT_AVAILABILITY.EVENT_ID.eq(eventId))))
                .execute();
    }

    /**
     * RESERVED rows whose holding booking is no longer PENDING (or missing).
     */
    public List<SeatRef> findReservationsWithoutPendingBooking() {
        return dsl.select(SEAT_AVAILABILITY.EVENT_ID, SEAT_AVAILABILITY.SEAT_ID, SEAT_AVAILABILITY.BOOKING_ID)
                .from(SEAT_AVAILABILITY.TABLE)
                .leftJoin(BOOKINGS.TABLE).on(BOOKINGS.ID.eq(SEAT_AVAILABILITY.BOOKING_ID))
                .where(SEAT_AVAILABILITY.STATE.eq(SeatState.RESERVED.name()))
                .and(BOOKINGS.ID.isNull().or(BOOKINGS.STATUS.ne("PENDING")))
                .orderBy(SEAT_AVAILABILITY.EVENT_ID, SEAT_AVAILABILITY.SEAT_ID)
                .fetch(this::toSeatRef);
    }

    /**
     * BOOKED rows with no live (VALID or USED) ticket for the same seat and event.
     */
    public List<SeatRef> findBookedSeatsWithoutLiveTicket() {
        return dsl.select(SEAT_AVAILABILITY.EVENT_ID, SEAT_AVAILABILITY.SEAT_ID, SEAT_AVAILABILITY.BOOKING_ID)
                .from(SEAT_AVAILABILITY.TABLE)
                .where(SEAT_AVAILABILITY.STATE.eq(SeatState.BOOKED.name()))
                .andNotExists(dsl.selectOne()
                        .from(TICKETS.TABLE)
                        .where(TICKETS.EVENT_ID.eq(SEAT_AVAILABILITY.EVENT_ID))
                        .and(TICKETS.SEAT_ID.eq(SEAT_AVAILABILITY.SEAT_ID))
                        .and(TICKETS.STATUS.in("VALID", "USED")))
                .orderBy(SEAT_AVAILABILITY.EVENT_ID, SEAT_AVAILABILITY.SEAT_ID)
                .fetch(this::toSeatRef);
    }

    /**
     * Live tickets whose seat is not BOOKED for the ticket's event.
     */
    public List<SeatRef> findLiveTicketsWithoutBookedSeat() {
        return dsl.select(TICKETS.EVENT_ID, TICKETS.SEAT_ID, TICKETS.ID)
                .from(TICKETS.TABLE)
                .where(TICKETS.STATUS.in("VALID", "USED"))
                .andNotExists(dsl.selectOne()
                        .from(SEAT_AVAILABILITY.TABLE)
                        .where(SEAT_AVAILABILITY.EVENT_ID.eq(TICKETS.EVENT_ID))
                        .and(SEAT_AVAILABILITY.SEAT_ID.eq(TICKETS.SEAT_ID))
                        .and(SEAT_AVAILABILITY.STATE.eq(SeatState.BOOKED.name())))
                .orderBy(TICKETS.EVENT_ID, TICKETS.SEAT_ID)
                .fetch(r -> new SeatRef(r.get(TICKETS.EVENT_ID), r.get(TICKETS.SEAT_ID), r.get(TICKETS.ID)));
    }

    private SeatRef toSeatRef(Record r) {
        return new SeatRef(
                r.get(SEAT_AVAILABILITY.EVENT_ID),
                r.get(SEAT_AVAILABILITY.SEAT_ID),
                r.get(SEAT_AVAILABILITY.BOOKING_ID));
    }

    private static SeatState effectiveState(String state, LocalDateTime expiresAt, LocalDateTime now) {
        SeatState stored = SeatState.valueOf(state);
        if (stored == SeatState.RESERVED && expiresAt != null && expiresAt.isBefore(now)) {
            return SeatState.FREE;
        }
        return stored;
    }
}
