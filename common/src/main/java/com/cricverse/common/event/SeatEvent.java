package com.cricverse.common.event;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Occupancy change of one or more seats for an event, used by seat-map caches downstream.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SeatEvent extends DomainEvent {

    public static final String TYPE_STATUS_CHANGED = "SEAT_STATUS_CHANGED";

    private Long eventId;
    private List<Long> seatIds;
    private String fromState;
    private String toState;
    private Long bookingId;

    private SeatEvent(Long eventId, List<Long> seatIds, String fromState, String toState, Long bookingId) {
        super(TYPE_STATUS_CHANGED);
        this.eventId = eventId;
        this.seatIds = seatIds;
        this.fromState = fromState;
        this.toState = toState;
        this.bookingId = bookingId;
    }

    public static SeatEvent statusChanged(Long eventId, List<Long> seatIds,
                                          String fromState, String toState, Long bookingId) {
        return new SeatEvent(eventId, seatIds, fromState, toState, bookingId);
    }
}
