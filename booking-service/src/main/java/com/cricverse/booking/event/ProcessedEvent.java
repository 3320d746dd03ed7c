package com.cricverse.booking.event;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Marker row for an inbound message that was fully handled. The message id is the primary key,
 * so a concurrent second handler fails on insert instead of applying the message twice.
 */
@Entity
@Table(name = "processed_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProcessedEvent {

    @Id
    @Column(name = "message_id", length = 36)
    private String messageId;

    @Column(name = "topic", nullable = false, length = 100)
    private String sourceTopic;

    @Column(nullable = false)
    private LocalDateTime processedAt;

    private ProcessedEvent(String messageId, String sourceTopic, LocalDateTime processedAt) {
        this.messageId = messageId;
        this.sourceTopic = sourceTopic;
        this.processedAt = processedAt;
    }

    public static ProcessedEvent handled(String messageId, String sourceTopic, LocalDateTime processedAt) {
        return new ProcessedEvent(messageId, sourceTopic, processedAt);
    }
}
