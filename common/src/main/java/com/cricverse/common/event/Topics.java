package com.cricverse.common.event;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class Topics {

    // Booking
    public static final String BOOKING_RESERVED = "cricverse.booking.reserved";
    public static final String BOOKING_CONFIRMED = "cricverse.booking.confirmed";
    public static final String BOOKING_RELEASED = "cricverse.booking.released";

    // Seat
    public static final String SEAT_STATUS_CHANGED = "cricverse.seat.status-changed";

    // Ticket
    public static final String TICKET_ISSUED = "cricverse.ticket.issued";
    public static final String TICKET_CANCELLED = "cricverse.ticket.cancelled";
    public static final String TICKET_TRANSFERRED = "cricverse.ticket.transferred";

    // Payment (inbound)
    public static final String PAYMENT_COMPLETED = "cricverse.payment.completed";
    public static final String PAYMENT_FAILED = "cricverse.payment.failed";

    // Event catalogue (inbound)
    public static final String EVENT_SCHEDULED = "cricverse.event.scheduled";

    // Dead Letter Topics (DLT) - suffix: .DLT
    public static final String DLT_SUFFIX = ".DLT";

    // Partition counts per topic category
    public static final int PARTITIONS_BOOKING = 8;
    public static final int PARTITIONS_SEAT = 8;
    public static final int PARTITIONS_TICKET = 6;
    public static final int PARTITIONS_PAYMENT = 6;
    public static final int PARTITIONS_EVENT = 3;

    public static String dlt(String topic) {
        return topic + DLT_SUFFIX;
    }
}
