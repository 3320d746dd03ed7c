package com.cricverse.common.event;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Published by the event catalogue when a match is scheduled at a stadium.
 * The booking service materializes the per-event seat inventory on receipt.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class EventScheduledEvent extends DomainEvent {

    public static final String TYPE = "EVENT_SCHEDULED";

    private Long eventId;
    private Long stadiumId;
    private String name;
    private LocalDateTime startsAt;

    public EventScheduledEvent(Long eventId, Long stadiumId, String name, LocalDateTime startsAt) {
        super(TYPE);
        this.eventId = eventId;
        this.stadiumId = stadiumId;
        this.name = name;
        this.startsAt = startsAt;
    }
}
