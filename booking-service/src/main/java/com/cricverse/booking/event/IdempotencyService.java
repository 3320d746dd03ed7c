package com.cricverse.booking.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Consumer-side deduplication keyed on the message id, backed by the processed_events primary key.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdempotencyService {

    private final ProcessedEventRepository processedEventRepository;
    private final Clock clock;

    /**
     * True when the message was already handled and should be skipped.
     */
    public boolean isDuplicate(String messageId, String topic) {
        if (messageId == null) {
            return false;
        }
        return processedEventRepository.existsById(messageId);
    }

    public void markProcessed(String messageId, String topic) {
        if (messageId == null) {
            return;
        }
        try {
            processedEventRepository.save(ProcessedEvent.handled(messageId, topic, LocalDateTime.now(clock)));
        } catch (DataIntegrityViolationException e) {
            log.debug("Duplicate message insert ignored: messageId={}, topic={}", messageId, topic);
        }
    }
}
