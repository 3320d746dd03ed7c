package com.cricverse.common.event;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Envelope fields shared by every message on the bus.
 * {@code messageId} identifies the message itself and is the deduplication key for consumers.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class DomainEvent {

    private String messageId;
    private String eventType;
    private Instant occurredAt;

    protected DomainEvent(String eventType) {
        this.messageId = UUID.randomUUID().toString();
        this.eventType = eventType;
        this.occurredAt = Instant.now();
    }
}
