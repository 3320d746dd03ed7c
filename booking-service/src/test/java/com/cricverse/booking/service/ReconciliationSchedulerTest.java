package com.cricverse.booking.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;

import java.util.concurrent.TimeUnit;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReconciliationSchedulerTest {

    @Mock private DataReconciliationService reconciliationService;
    @Mock private RedissonClient redissonClient;
    @Mock private RLock lock;

    @InjectMocks
    private ReconciliationScheduler scheduler;

    @Test
    void runReconciliation_lockAcquired_runsAllChecksAndUnlocks() throws InterruptedException {
        when(redissonClient.getLock("lock:cricverse:reconciliation")).thenReturn(lock);
        when(lock.tryLock(eq(0L), anyLong(), eq(TimeUnit.SECONDS))).thenReturn(true);
        when(lock.isHeldByCurrentThread()).thenReturn(true);

        scheduler.runReconciliation();

        verify(reconciliationService).reconcileOrphanedReservations();
        verify(reconciliationService).detectTicketSeatMismatch();
        verify(reconciliationService).reconcileExpiredPendingBookings();
        verify(lock).unlock();
    }

    @Test
    void runReconciliation_lockHeldElsewhere_skips() throws InterruptedException {
        when(redissonClient.getLock("lock:cricverse:reconciliation")).thenReturn(lock);
        when(lock.tryLock(eq(0L), anyLong(), eq(TimeUnit.SECONDS))).thenReturn(false);

        scheduler.runReconciliation();

        verifyNoInteractions(reconciliationService);
        verify(lock, never()).unlock();
    }

    @Test
    void runReconciliation_checkFails_stillUnlocks() throws InterruptedException {
        when(redissonClient.getLock("lock:cricverse:reconciliation")).thenReturn(lock);
        when(lock.tryLock(eq(0L), anyLong(), eq(TimeUnit.SECONDS))).thenReturn(true);
        when(lock.isHeldByCurrentThread()).thenReturn(true);
        when(reconciliationService.reconcileOrphanedReservations()).thenThrow(new RuntimeException("db down"));

        scheduler.runReconciliation();

        verify(lock).unlock();
    }
}
