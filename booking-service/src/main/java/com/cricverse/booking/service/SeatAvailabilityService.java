package com.cricverse.booking.service;

import com.cricverse.booking.domain.SeatAvailability;
import com.cricverse.booking.domain.SeatState;
import com.cricverse.booking.jooq.SeatAvailabilityJooqRepository;
import com.cricverse.booking.jooq.SeatMapRow;
import com.cricverse.booking.repository.EventRepository;
import com.cricverse.booking.repository.SeatAvailabilityRepository;
import com.cricverse.common.exception.BusinessException;
import com.cricverse.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Non-locking availability reads for display. Results are advisory: a seat shown
 * FREE may be gone by the time a reservation is attempted. Reservations past their
 * expiry are reported as FREE even before the sweep runs.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SeatAvailabilityService {

    private final SeatAvailabilityRepository seatAvailabilityRepository;
    private final SeatAvailabilityJooqRepository seatLedger;
    private final EventRepository eventRepository;
    private final Clock clock;

    /**
     * Effective state per requested seat, in ascending seat id order.
     * Seats not on sale for the event are omitted.
     */
    public Map<Long, SeatState> getAvailability(Long eventId, Collection<Long> seatIds) {
        requireEvent(eventId);
        LocalDateTime now = LocalDateTime.now(clock);
        Map<Long, SeatState> found = new HashMap<>();
        for (SeatAvailability row : seatAvailabilityRepository.findByEventIdAndSeatIdIn(eventId, seatIds)) {
            found.put(row.getSeatId(), row.effectiveState(now));
        }
        Map<Long, SeatState> states = new LinkedHashMap<>();
        for (Long seatId : new TreeSet<>(seatIds)) {
            if (found.containsKey(seatId)) {
                states.put(seatId, found.get(seatId));
            }
        }
        return states;
    }

    public List<SeatMapRow> getSeatMap(Long eventId) {
        requireEvent(eventId);
        return seatLedger.findSeatMap(eventId, LocalDateTime.now(clock));
    }

    private void requireEvent(Long eventId) {
        if (!eventRepository.existsById(eventId)) {
            throw new BusinessException(ErrorCode.EVENT_NOT_FOUND, "Event not found: " + eventId);
        }
    }
}
