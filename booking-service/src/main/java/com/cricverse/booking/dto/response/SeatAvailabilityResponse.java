package com.cricverse.booking.dto.response;

import com.cricverse.booking.domain.SeatState;

import java.util.List;
import java.util.Map;

public record SeatAvailabilityResponse(Long eventId, List<SeatStatus> seats) {

    public record SeatStatus(Long seatId, SeatState state) {
    }

    public static SeatAvailabilityResponse of(Long eventId, Map<Long, SeatState> states) {
        List<SeatStatus> seats = states.entrySet().stream()
                .map(e -> new SeatStatus(e.getKey(), e.getValue()))
                .toList();
        return new SeatAvailabilityResponse(eventId, seats);
    }
}
