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
import com.cricverse.common.exception.BusinessException;
import com.cricverse.common.response.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DataReconciliationServiceTest {

    private static final Long EVENT_ID = 3L;
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 1, 1, 12, 0);

    @Mock private SeatAvailabilityJooqRepository seatLedger;
    @Mock private BookingRepository bookingRepository;
    @Mock private BookingTransactionService transactionService;
    @Mock private BookingEventProducer bookingEventProducer;

    private DataReconciliationService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        service = new DataReconciliationService(seatLedger, bookingRepository, transactionService,
                bookingEventProducer, new BookingProperties(), clock);
    }

    @Test
    void reconcileOrphanedReservations_freesSeatsStillHeldByDeadBooking() {
        when(seatLedger.findReservationsWithoutPendingBooking()).thenReturn(List.of(
                new SeatRef(EVENT_ID, 101L, 12L),
                new SeatRef(EVENT_ID, 102L, 12L)));
        when(seatLedger.lockForUpdate(EVENT_ID, List.of(101L, 102L))).thenReturn(List.of(
                new LockedSeat(101L, SeatState.RESERVED, 12L, 7L, NOW.plusMinutes(3)),
                new LockedSeat(102L, SeatState.RESERVED, 13L, 8L, NOW.plusMinutes(9))));
        when(seatLedger.freeReserved(EVENT_ID, List.of(101L), 12L, NOW)).thenReturn(1);

        int released = service.reconcileOrphanedReservations();

        assertThat(released).isEqualTo(1);
        verify(bookingEventProducer).publishSeatsChanged(EVENT_ID, List.of(101L),
                SeatState.RESERVED, SeatState.FREE, 12L);
    }

    @Test
    void reconcileOrphanedReservations_locksAllOrphansOfAnEventInAscendingSeatOrder() {
        when(seatLedger.findReservationsWithoutPendingBooking()).thenReturn(List.of(
                new SeatRef(EVENT_ID, 103L, 11L),
                new SeatRef(EVENT_ID, 101L, 12L)));
        when(seatLedger.lockForUpdate(EVENT_ID, List.of(101L, 103L))).thenReturn(List.of(
                new LockedSeat(101L, SeatState.RESERVED, 12L, 7L, NOW.plusMinutes(3)),
                new LockedSeat(103L, SeatState.RESERVED, 11L, 8L, NOW.plusMinutes(4))));
        when(seatLedger.freeReserved(EVENT_ID, List.of(103L), 11L, NOW)).thenReturn(1);
        when(seatLedger.freeReserved(EVENT_ID, List.of(101L), 12L, NOW)).thenReturn(1);

        int released = service.reconcileOrphanedReservations();

        assertThat(released).isEqualTo(2);
        verify(seatLedger, times(1)).lockForUpdate(any(), anyList());
        InOrder inOrder = inOrder(seatLedger);
        inOrder.verify(seatLedger).lockForUpdate(EVENT_ID, List.of(101L, 103L));
        inOrder.verify(seatLedger).freeReserved(EVENT_ID, List.of(103L), 11L, NOW);
        inOrder.verify(seatLedger).freeReserved(EVENT_ID, List.of(101L), 12L, NOW);
    }

    @Test
    void reconcileOrphanedReservations_noOrphans_returnsZero() {
        when(seatLedger.findReservationsWithoutPendingBooking()).thenReturn(List.of());

        assertThat(service.reconcileOrphanedReservations()).isZero();
        verify(seatLedger, never()).lockForUpdate(any(), anyList());
    }

    @Test
    void detectTicketSeatMismatch_countsBothDirections() {
        when(seatLedger.findBookedSeatsWithoutLiveTicket()).thenReturn(List.of(new SeatRef(EVENT_ID, 101L, 11L)));
        when(seatLedger.findLiveTicketsWithoutBookedSeat()).thenReturn(List.of(
                new SeatRef(EVENT_ID, 102L, 500L), new SeatRef(EVENT_ID, 103L, 501L)));

        assertThat(service.detectTicketSeatMismatch()).isEqualTo(3);
        verify(seatLedger, never()).freeBooked(any(), anyList(), any(), any());
    }

    @Test
    void reconcileExpiredPendingBookings_continuesPastFailures() {
        when(bookingRepository.findIdsByStatusAndHoldExpiresAtBefore(
                BookingStatus.PENDING, NOW, PageRequest.of(0, 200))).thenReturn(List.of(10L, 11L));
        when(transactionService.releaseBooking(10L, ReleaseReason.EXPIRED))
                .thenThrow(new BusinessException(ErrorCode.INVALID_BOOKING_STATE, "confirmed"));

        int released = service.reconcileExpiredPendingBookings();

        assertThat(released).isEqualTo(1);
        verify(transactionService).releaseBooking(11L, ReleaseReason.EXPIRED);
    }
}
