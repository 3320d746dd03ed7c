package com.cricverse.booking.event.outbox;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Relays pending outbox rows to Kafka in id order. ShedLock keeps a single relay across replicas;
 * SKIP LOCKED keeps an overlapping run from picking the same rows.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxPollingPublisher {

    private static final int BATCH_SIZE = 50;

    private final OutboxEventRepository outboxEventRepository;
    private final OutboxEventPublisher outboxEventPublisher;

    @Scheduled(fixedDelay = 1000)
    @SchedulerLock(name = "outboxPolling", lockAtMostFor = "30s", lockAtLeastFor = "500ms")
    @Transactional
    public void pollAndPublish() {
        List<OutboxEvent> events = outboxEventRepository.lockRelayBatch(BATCH_SIZE);
        if (events.isEmpty()) {
            return;
        }

        log.debug("Polling {} outbox events", events.size());

        for (OutboxEvent event : events) {
            if (!outboxEventPublisher.publishEvent(event)) {
                // keep per-key ordering: later rows wait for the next poll
                break;
            }
        }
    }

    @Scheduled(cron = "0 0 4 * * *")
    @SchedulerLock(name = "outboxCleanup", lockAtMostFor = "5m", lockAtLeastFor = "1m")
    @Transactional
    public void cleanupPublishedEvents() {
        LocalDateTime cutoff = LocalDateTime.now().minusDays(3);
        int deleted = outboxEventRepository.purgePublishedBefore(cutoff);
        if (deleted > 0) {
            log.info("Cleaned up {} published outbox events older than {}", deleted, cutoff);
        }
    }
}
