package com.cricverse.booking.jooq;

import com.cricverse.booking.domain.SeatState;

import java.math.BigDecimal;

public record SeatMapRow(Long seatId, String section, String rowLabel, Integer seatNumber,
                         String seatType, BigDecimal basePrice, SeatState state) {
}
