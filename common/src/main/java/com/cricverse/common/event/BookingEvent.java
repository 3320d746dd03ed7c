package com.cricverse.common.event;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BookingEvent extends DomainEvent {

    public static final String TYPE_RESERVED = "BOOKING_RESERVED";
    public static final String TYPE_CONFIRMED = "BOOKING_CONFIRMED";
    public static final String TYPE_RELEASED = "BOOKING_RELEASED";

    private Long bookingId;
    private Long customerId;
    private Long eventId;
    private List<Long> seatIds;
    private BigDecimal totalAmount;
    private String status;
    private String reason;
    private LocalDateTime holdExpiresAt;

    private BookingEvent(String eventType, Long bookingId, Long customerId, Long eventId,
                         List<Long> seatIds, BigDecimal totalAmount, String status,
                         String reason, LocalDateTime holdExpiresAt) {
        super(eventType);
        this.bookingId = bookingId;
        this.customerId = customerId;
        this.eventId = eventId;
        this.seatIds = seatIds;
        this.totalAmount = totalAmount;
        this.status = status;
        this.reason = reason;
        this.holdExpiresAt = holdExpiresAt;
    }

    public static BookingEvent reserved(Long bookingId, Long customerId, Long eventId,
                                        List<Long> seatIds, BigDecimal totalAmount,
                                        LocalDateTime holdExpiresAt) {
        return new BookingEvent(TYPE_RESERVED, bookingId, customerId, eventId,
                seatIds, totalAmount, "PENDING", null, holdExpiresAt);
    }

    public static BookingEvent confirmed(Long bookingId, Long customerId, Long eventId,
                                         List<Long> seatIds, BigDecimal totalAmount) {
        return new BookingEvent(TYPE_CONFIRMED, bookingId, customerId, eventId,
                seatIds, totalAmount, "CONFIRMED", null, null);
    }

    public static BookingEvent released(Long bookingId, Long customerId, Long eventId,
                                        List<Long> seatIds, String status, String reason) {
        return new BookingEvent(TYPE_RELEASED, bookingId, customerId, eventId,
                seatIds, null, status, reason, null);
    }
}
