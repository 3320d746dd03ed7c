package com.cricverse.booking.event;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IdempotencyServiceTest {

    private static final LocalDateTime PROCESSED_AT = LocalDateTime.of(2026, 1, 1, 12, 0);

    @Mock
    private ProcessedEventRepository processedEventRepository;

    private IdempotencyService idempotencyService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(PROCESSED_AT.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        idempotencyService = new IdempotencyService(processedEventRepository, clock);
    }

    @Test
    void isDuplicate_knownMessage_returnsTrue() {
        when(processedEventRepository.existsById("msg-1")).thenReturn(true);

        assertThat(idempotencyService.isDuplicate("msg-1", "payment.completed")).isTrue();
    }

    @Test
    void isDuplicate_newMessage_returnsFalse() {
        when(processedEventRepository.existsById("msg-2")).thenReturn(false);

        assertThat(idempotencyService.isDuplicate("msg-2", "payment.completed")).isFalse();
    }

    @Test
    void isDuplicate_missingMessageId_treatedAsNew() {
        assertThat(idempotencyService.isDuplicate(null, "payment.completed")).isFalse();
        verifyNoInteractions(processedEventRepository);
    }

    @Test
    void markProcessed_recordsMessageWithClockTime() {
        idempotencyService.markProcessed("msg-1", "payment.completed");

        ArgumentCaptor<ProcessedEvent> captor = ArgumentCaptor.forClass(ProcessedEvent.class);
        verify(processedEventRepository).save(captor.capture());
        assertThat(captor.getValue().getMessageId()).isEqualTo("msg-1");
        assertThat(captor.getValue().getSourceTopic()).isEqualTo("payment.completed");
        assertThat(captor.getValue().getProcessedAt()).isEqualTo(PROCESSED_AT);
    }

    @Test
    void markProcessed_concurrentInsert_ignored() {
        when(processedEventRepository.save(any(ProcessedEvent.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key"));

        assertThatCode(() -> idempotencyService.markProcessed("msg-1", "payment.completed"))
                .doesNotThrowAnyException();
    }
}
