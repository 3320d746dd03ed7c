package com.cricverse.booking.dto.response;

import com.cricverse.booking.domain.Booking;
import com.cricverse.booking.domain.BookingStatus;
import com.cricverse.booking.domain.ReleaseReason;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public record BookingResponse(
        Long bookingId,
        Long customerId,
        Long eventId,
        BookingStatus status,
        BigDecimal totalAmount,
        LocalDateTime holdExpiresAt,
        ReleaseReason releaseReason,
        List<SeatInfo> seats,
        LocalDateTime createdAt
) {
    public record SeatInfo(Long seatId, BigDecimal price) {
    }

    public static BookingResponse from(Booking booking) {
        List<SeatInfo> seats = booking.getBookingSeats().stream()
                .map(bs -> new SeatInfo(bs.getSeatId(), bs.getPrice()))
                .toList();
        return new BookingResponse(
                booking.getId(),
                booking.getCustomerId(),
                booking.getEventId(),
                booking.getStatus(),
                booking.getTotalAmount(),
                booking.getHoldExpiresAt(),
                booking.getReleaseReason(),
                seats,
                booking.getCreatedAt()
        );
    }
}
