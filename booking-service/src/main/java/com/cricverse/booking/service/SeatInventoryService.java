package com.cricverse.booking.service;

import com.cricverse.booking.domain.Event;
import com.cricverse.booking.jooq.SeatAvailabilityJooqRepository;
import com.cricverse.booking.repository.EventRepository;
import com.cricverse.booking.repository.SeatAvailabilityRepository;
import com.cricverse.booking.repository.SeatRepository;
import com.cricverse.common.exception.BusinessException;
import com.cricverse.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Puts an event's seats on sale by creating one FREE ledger row per stadium seat.
 * Re-running it only adds rows for seats that were missing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SeatInventoryService {

    private final EventRepository eventRepository;
    private final SeatRepository seatRepository;
    private final SeatAvailabilityRepository seatAvailabilityRepository;
    private final SeatAvailabilityJooqRepository seatLedger;
    private final Clock clock;

    public record InventoryResult(Long eventId, int created, long onSale, long stadiumSeats) {
    }

    @Transactional
    public InventoryResult openEvent(Long eventId) {
        Event event = eventRepository.findById(eventId)
                .orElseThrow(() -> new BusinessException(ErrorCode.EVENT_NOT_FOUND, "Event not found: " + eventId));

        int created = seatLedger.materializeEvent(eventId, event.getStadiumId(), LocalDateTime.now(clock));
        long onSale = seatAvailabilityRepository.countByEventId(eventId);
        long stadiumSeats = seatRepository.countByStadiumId(event.getStadiumId());

        log.info("Seat inventory opened: eventId={}, stadiumId={}, created={}, onSale={}/{}",
                eventId, event.getStadiumId(), created, onSale, stadiumSeats);
        return new InventoryResult(eventId, created, onSale, stadiumSeats);
    }
}
