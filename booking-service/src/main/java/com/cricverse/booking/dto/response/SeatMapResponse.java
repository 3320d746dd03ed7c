package com.cricverse.booking.dto.response;

import com.cricverse.booking.domain.Seat;
import com.cricverse.booking.domain.SeatState;
import com.cricverse.booking.jooq.SeatMapRow;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Seat map grouped by section, preserving the section/row/number order of the query.
 */
public record SeatMapResponse(Long eventId, long freeSeats, List<Section> sections) {

    public record Section(String name, String accessGate, List<SeatView> seats) {
    }

    public record SeatView(Long seatId, String label, String rowLabel, Integer seatNumber,
                           String seatType, BigDecimal price, SeatState state) {
    }

    public static SeatMapResponse of(Long eventId, List<SeatMapRow> rows) {
        Map<String, List<SeatMapRow>> bySection = rows.stream()
                .collect(Collectors.groupingBy(SeatMapRow::section, LinkedHashMap::new, Collectors.toList()));
        List<Section> sections = bySection.entrySet().stream()
                .map(e -> new Section(e.getKey(), Seat.accessGate(e.getKey()),
                        e.getValue().stream()
                                .map(r -> new SeatView(r.seatId(),
                                        Seat.label(r.section(), r.rowLabel(), r.seatNumber()),
                                        r.rowLabel(), r.seatNumber(), r.seatType(), r.basePrice(), r.state()))
                                .toList()))
                .toList();
        long free = rows.stream().filter(r -> r.state() == SeatState.FREE).count();
        return new SeatMapResponse(eventId, free, sections);
    }
}
