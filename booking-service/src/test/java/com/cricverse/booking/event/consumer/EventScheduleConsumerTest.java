package com.cricverse.booking.event.consumer;

import com.cricverse.booking.domain.Event;
import com.cricverse.booking.event.IdempotencyService;
import com.cricverse.booking.repository.EventRepository;
import com.cricverse.booking.service.SeatInventoryService;
import com.cricverse.common.event.EventScheduledEvent;
import com.cricverse.common.event.Topics;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EventScheduleConsumerTest {

    private static final LocalDateTime STARTS_AT = LocalDateTime.of(2026, 3, 20, 19, 30);

    @Mock private EventRepository eventRepository;
    @Mock private SeatInventoryService seatInventoryService;
    @Mock private IdempotencyService idempotencyService;

    @InjectMocks
    private EventScheduleConsumer consumer;

    @Test
    void handleEventScheduled_newEvent_savesAndOpensInventory() {
        EventScheduledEvent message = new EventScheduledEvent(3L, 1L, "Final", STARTS_AT);
        when(idempotencyService.isDuplicate(message.getMessageId(), Topics.EVENT_SCHEDULED)).thenReturn(false);
        when(eventRepository.findById(3L)).thenReturn(Optional.empty());

        consumer.handleEventScheduled(message);

        ArgumentCaptor<Event> captor = ArgumentCaptor.forClass(Event.class);
        verify(eventRepository).save(captor.capture());
        assertThat(captor.getValue().getStadiumId()).isEqualTo(1L);
        assertThat(captor.getValue().isNew()).isTrue();
        verify(seatInventoryService).openEvent(3L);
        verify(idempotencyService).markProcessed(message.getMessageId(), Topics.EVENT_SCHEDULED);
    }

    @Test
    void handleEventScheduled_existingEvent_updatesButKeepsStadium() {
        Event existing = new Event(3L, 1L, "Semi", STARTS_AT.minusDays(1));
        EventScheduledEvent message = new EventScheduledEvent(3L, 2L, "Final", STARTS_AT);
        when(idempotencyService.isDuplicate(message.getMessageId(), Topics.EVENT_SCHEDULED)).thenReturn(false);
        when(eventRepository.findById(3L)).thenReturn(Optional.of(existing));

        consumer.handleEventScheduled(message);

        assertThat(existing.getName()).isEqualTo("Final");
        assertThat(existing.getStartsAt()).isEqualTo(STARTS_AT);
        assertThat(existing.getStadiumId()).isEqualTo(1L);
        verify(eventRepository).save(existing);
        verify(seatInventoryService).openEvent(3L);
    }

    @Test
    void handleEventScheduled_duplicate_skipped() {
        EventScheduledEvent message = new EventScheduledEvent(3L, 1L, "Final", STARTS_AT);
        when(idempotencyService.isDuplicate(message.getMessageId(), Topics.EVENT_SCHEDULED)).thenReturn(true);

        consumer.handleEventScheduled(message);

        verify(eventRepository, never()).save(any());
        verifyNoInteractions(seatInventoryService);
    }
}
