package com.cricverse.booking.event.outbox;

import com.cricverse.common.event.DomainEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Records domain events in the outbox as part of the ledger transaction that produced them.
 * Rows are keyed by the cricket event id, so every change to one event's seats is relayed
 * to the same Kafka partition in commit order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboxEventService {

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;

    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent append(String topic, String aggregateType, Long aggregateId,
                              Long cricketEventId, DomainEvent event) {
        OutboxEvent row = new OutboxEvent(aggregateType, String.valueOf(aggregateId),
                event.getEventType(), topic, String.valueOf(cricketEventId), toJson(event));
        OutboxEvent saved = outboxEventRepository.save(row);
        log.debug("Outbox append: topic={}, type={}, {}={}, messageId={}",
                topic, event.getEventType(), aggregateType, aggregateId, event.getMessageId());
        return saved;
    }

    private String toJson(DomainEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + event.getEventType()
                    + " message " + event.getMessageId(), e);
        }
    }
}
