package com.cricverse.booking.event.consumer;

import com.cricverse.booking.domain.Event;
import com.cricverse.booking.event.IdempotencyService;
import com.cricverse.booking.repository.EventRepository;
import com.cricverse.booking.service.SeatInventoryService;
import com.cricverse.common.event.EventScheduledEvent;
import com.cricverse.common.event.Topics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Syncs scheduled matches from the event catalogue and opens their seat inventory.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventScheduleConsumer {

    private final EventRepository eventRepository;
    private final SeatInventoryService seatInventoryService;
    private final IdempotencyService idempotencyService;

    @KafkaListener(topics = Topics.EVENT_SCHEDULED, groupId = "booking-service")
    @Transactional
    public void handleEventScheduled(EventScheduledEvent message) {
        if (idempotencyService.isDuplicate(message.getMessageId(), Topics.EVENT_SCHEDULED)) {
            log.debug("Duplicate event-scheduled message skipped: messageId={}", message.getMessageId());
            return;
        }

        log.info("Received event-scheduled message: eventId={}, stadiumId={}",
                message.getEventId(), message.getStadiumId());

        eventRepository.findById(message.getEventId())
                .ifPresentOrElse(
                        existing -> {
                            if (!existing.getStadiumId().equals(message.getStadiumId())) {
                                log.warn("Stadium change ignored for eventId={}: current={}, received={}",
                                        existing.getId(), existing.getStadiumId(), message.getStadiumId());
                            }
                            existing.updateFrom(message.getName(), message.getStartsAt());
                            eventRepository.save(existing);
                        },
                        () -> eventRepository.save(new Event(message.getEventId(), message.getStadiumId(),
                                message.getName(), message.getStartsAt())));

        seatInventoryService.openEvent(message.getEventId());
        idempotencyService.markProcessed(message.getMessageId(), Topics.EVENT_SCHEDULED);
    }
}
