package com.cricverse.booking;

import com.cricverse.booking.domain.Booking;
import com.cricverse.booking.domain.BookingStatus;
import com.cricverse.booking.domain.ReleaseReason;
import com.cricverse.booking.domain.Ticket;

import java.lang.reflect.Field;
import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Shared test utility for creating entities with preset IDs.
 * Uses reflection because JPA @Id fields have no public setter.
 */
public final class TestFixtures {

    public static final BigDecimal SEAT_PRICE = new BigDecimal("2500.00");

    private TestFixtures() {}

    public static void setEntityId(Object entity, Long id) {
        try {
            Field field = entity.getClass().getDeclaredField("id");
            field.setAccessible(true);
            field.set(entity, id);
        } catch (NoSuchFieldException | IllegalAccessException e) {
            throw new RuntimeException("Failed to set ID on " + entity.getClass().getSimpleName(), e);
        }
    }

    public static Booking createBooking(Long id, Long customerId, Long eventId,
                                        LocalDateTime holdExpiresAt, Long... seatIds) {
        Booking booking = Booking.builder()
                .customerId(customerId)
                .eventId(eventId)
                .holdExpiresAt(holdExpiresAt)
                .build();
        setEntityId(booking, id);
        for (Long seatId : seatIds) {
            booking.addSeat(seatId, SEAT_PRICE);
        }
        return booking;
    }

    public static Booking createBookingInStatus(Long id, Long customerId, Long eventId,
                                                BookingStatus status, Long... seatIds) {
        Booking booking = createBooking(id, customerId, eventId,
                LocalDateTime.of(2026, 1, 1, 12, 10), seatIds);
        if (status == BookingStatus.CONFIRMED) {
            booking.confirm("PAY-1");
        } else if (status == BookingStatus.FAILED) {
            booking.release(ReleaseReason.EXPIRED);
        } else if (status == BookingStatus.CANCELLED) {
            booking.release(ReleaseReason.CUSTOMER_CANCELLED);
        }
        return booking;
    }

    public static Ticket createTicket(Long id, Long bookingId, Long eventId, Long seatId, Long customerId) {
        Ticket ticket = Ticket.builder()
                .bookingId(bookingId)
                .eventId(eventId)
                .seatId(seatId)
                .customerId(customerId)
                .accessGate("Gate N")
                .build();
        setEntityId(ticket, id);
        return ticket;
    }
}
