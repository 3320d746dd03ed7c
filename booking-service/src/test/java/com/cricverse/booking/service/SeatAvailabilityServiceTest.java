package com.cricverse.booking.service;

import com.cricverse.booking.domain.SeatAvailability;
import com.cricverse.booking.domain.SeatState;
import com.cricverse.booking.jooq.SeatAvailabilityJooqRepository;
import com.cricverse.booking.jooq.SeatMapRow;
import com.cricverse.booking.repository.EventRepository;
import com.cricverse.booking.repository.SeatAvailabilityRepository;
import com.cricverse.common.exception.BusinessException;
import com.cricverse.common.response.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SeatAvailabilityServiceTest {

    private static final Long EVENT_ID = 3L;
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 1, 1, 12, 0);

    @Mock private SeatAvailabilityRepository seatAvailabilityRepository;
    @Mock private SeatAvailabilityJooqRepository seatLedger;
    @Mock private EventRepository eventRepository;

    private SeatAvailabilityService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        service = new SeatAvailabilityService(seatAvailabilityRepository, seatLedger, eventRepository, clock);
    }

    @Test
    void getAvailability_reportsExpiredReservationAsFreeAndOmitsUnknownSeats() {
        when(eventRepository.existsById(EVENT_ID)).thenReturn(true);
        List<Long> requested = List.of(104L, 101L, 102L, 103L, 999L);
        when(seatAvailabilityRepository.findByEventIdAndSeatIdIn(EVENT_ID, requested)).thenReturn(List.of(
                new SeatAvailability(101L, EVENT_ID, SeatState.FREE, null, null, null, NOW),
                new SeatAvailability(102L, EVENT_ID, SeatState.RESERVED, 7L, 11L, NOW.plusMinutes(2), NOW),
                new SeatAvailability(103L, EVENT_ID, SeatState.RESERVED, 7L, 12L, NOW.minusSeconds(1), NOW),
                new SeatAvailability(104L, EVENT_ID, SeatState.BOOKED, 7L, 13L, null, NOW)));

        Map<Long, SeatState> states = service.getAvailability(EVENT_ID, requested);

        assertThat(states).containsExactly(
                Map.entry(101L, SeatState.FREE),
                Map.entry(102L, SeatState.RESERVED),
                Map.entry(103L, SeatState.FREE),
                Map.entry(104L, SeatState.BOOKED));
    }

    @Test
    void getAvailability_unknownEvent_throwsNotFound() {
        when(eventRepository.existsById(EVENT_ID)).thenReturn(false);

        assertThatThrownBy(() -> service.getAvailability(EVENT_ID, List.of(101L)))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.EVENT_NOT_FOUND));
        verifyNoInteractions(seatAvailabilityRepository);
    }

    @Test
    void getSeatMap_readsLedgerAtCurrentTime() {
        when(eventRepository.existsById(EVENT_ID)).thenReturn(true);
        List<SeatMapRow> rows = List.of(
                new SeatMapRow(101L, "N", "12", 1, "STANDARD", new BigDecimal("2500.00"), SeatState.FREE));
        when(seatLedger.findSeatMap(EVENT_ID, NOW)).thenReturn(rows);

        assertThat(service.getSeatMap(EVENT_ID)).isEqualTo(rows);
    }
}
