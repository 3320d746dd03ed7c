package com.cricverse.common.event;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TicketEvent extends DomainEvent {

    public static final String TYPE_ISSUED = "TICKET_ISSUED";
    public static final String TYPE_CANCELLED = "TICKET_CANCELLED";
    public static final String TYPE_TRANSFERRED = "TICKET_TRANSFERRED";

    private Long ticketId;
    private Long seatId;
    private Long eventId;
    private Long bookingId;
    private Long customerId;
    private String accessGate;
    private Long replacementTicketId;

    private TicketEvent(String eventType, Long ticketId, Long seatId, Long eventId,
                        Long bookingId, Long customerId, String accessGate, Long replacementTicketId) {
        super(eventType);
        this.ticketId = ticketId;
        this.seatId = seatId;
        this.eventId = eventId;
        this.bookingId = bookingId;
        this.customerId = customerId;
        this.accessGate = accessGate;
        this.replacementTicketId = replacementTicketId;
    }

    public static TicketEvent issued(Long ticketId, Long seatId, Long eventId,
                                     Long bookingId, Long customerId, String accessGate) {
        return new TicketEvent(TYPE_ISSUED, ticketId, seatId, eventId, bookingId, customerId, accessGate, null);
    }

    public static TicketEvent cancelled(Long ticketId, Long seatId, Long eventId,
                                        Long bookingId, Long customerId) {
        return new TicketEvent(TYPE_CANCELLED, ticketId, seatId, eventId, bookingId, customerId, null, null);
    }

    public static TicketEvent transferred(Long ticketId, Long seatId, Long eventId, Long bookingId,
                                          Long recipientId, Long replacementTicketId) {
        return new TicketEvent(TYPE_TRANSFERRED, ticketId, seatId, eventId, bookingId,
                recipientId, null, replacementTicketId);
    }
}
