package com.cricverse.booking.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs the reconciliation checks every five minutes on one pod at a time, using a Redisson lock.
 * Each check is invoked through the service proxy so its own transaction applies.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReconciliationScheduler {

    private static final String LOCK_KEY = "lock:cricverse:reconciliation";
    private static final long LOCK_LEASE_SECONDS = 240;

    private final DataReconciliationService reconciliationService;
    private final RedissonClient redissonClient;

    @Scheduled(fixedRate = 300_000, initialDelay = 60_000)
    public void runReconciliation() {
        RLock lock = redissonClient.getLock(LOCK_KEY);

        boolean acquired;
        try {
            acquired = lock.tryLock(0, LOCK_LEASE_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }

        if (!acquired) {
            log.debug("RECONCILE: Another pod is running reconciliation, skipping");
            return;
        }

        try {
            log.info("RECONCILE: Starting scheduled data reconciliation");

            int orphaned = reconciliationService.reconcileOrphanedReservations();
            int mismatches = reconciliationService.detectTicketSeatMismatch();
            int expired = reconciliationService.reconcileExpiredPendingBookings();

            Map<String, Integer> results = Map.of(
                    "orphanedReservationsFreed", orphaned,
                    "ticketSeatMismatches", mismatches,
                    "expiredPendingBookings", expired
            );
            log.info("RECONCILE: Completed - results={}", results);
        } catch (Exception e) {
            log.error("RECONCILE: Failed to complete reconciliation", e);
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }
}
