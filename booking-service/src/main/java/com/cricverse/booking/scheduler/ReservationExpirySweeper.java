package com.cricverse.booking.scheduler;

import com.cricverse.booking.config.BookingProperties;
import com.cricverse.booking.domain.BookingStatus;
import com.cricverse.booking.domain.ReleaseReason;
import com.cricverse.booking.jooq.SeatAvailabilityJooqRepository;
import com.cricverse.booking.repository.BookingRepository;
import com.cricverse.booking.service.BookingTransactionService;
import com.cricverse.common.exception.BusinessException;
import com.cricverse.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Set;
import java.util.TreeSet;

/**
 * Releases PENDING bookings whose reservation window has passed, freeing the seats they still hold.
 * Each booking is released in its own transaction, so one failure never blocks the batch.
 * Losing a race against a concurrent confirm or cancel is expected and only logged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReservationExpirySweeper {

    private final SeatAvailabilityJooqRepository seatLedger;
    private final BookingRepository bookingRepository;
    private final BookingTransactionService transactionService;
    private final BookingProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${cricverse.booking.sweep.interval-ms:30000}")
    @SchedulerLock(name = "reservationExpirySweep", lockAtMostFor = "5m", lockAtLeastFor = "1s")
    public void releaseExpiredReservations() {
        LocalDateTime now = LocalDateTime.now(clock);
        int batchSize = properties.getSweep().getBatchSize();

        Set<Long> bookingIds = new TreeSet<>(seatLedger.findBookingIdsWithExpiredReservations(now, batchSize));
        bookingIds.addAll(bookingRepository.findIdsByStatusAndHoldExpiresAtBefore(
                BookingStatus.PENDING, now, PageRequest.of(0, batchSize)));

        if (bookingIds.isEmpty()) {
            return;
        }

        log.info("Releasing {} expired reservations", bookingIds.size());

        int released = 0;
        for (Long bookingId : bookingIds) {
            try {
                transactionService.releaseBooking(bookingId, ReleaseReason.EXPIRED);
                released++;
            } catch (BusinessException e) {
                if (e.is(ErrorCode.INVALID_BOOKING_STATE) || e.is(ErrorCode.BOOKING_NOT_FOUND)) {
                    log.info("Expired reservation settled concurrently: bookingId={}, reason={}",
                            bookingId, e.getMessage());
                } else {
                    log.error("Failed to release expired reservation: bookingId={}", bookingId, e);
                }
            } catch (Exception e) {
                log.error("Failed to release expired reservation: bookingId={}", bookingId, e);
            }
        }
        log.info("Expiry sweep finished: released={}, candidates={}", released, bookingIds.size());
    }
}
