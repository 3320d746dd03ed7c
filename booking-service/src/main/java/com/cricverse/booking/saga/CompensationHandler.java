package com.cricverse.booking.saga;

import com.cricverse.booking.domain.ReleaseReason;
import com.cricverse.booking.service.BookingService;
import com.cricverse.common.exception.BusinessException;
import com.cricverse.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * SAGA compensation: releases a booking's seats when the payment leg fails.
 * A booking that already reached a terminal state needs no compensation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CompensationHandler {

    private final BookingService bookingService;

    public void compensate(Long bookingId, ReleaseReason reason) {
        log.info("SAGA compensation: bookingId={}, reason={}", bookingId, reason);
        try {
            bookingService.releaseBooking(bookingId, reason);
            log.info("SAGA compensation completed: bookingId={}", bookingId);
        } catch (BusinessException e) {
            if (e.is(ErrorCode.INVALID_BOOKING_STATE) || e.is(ErrorCode.BOOKING_NOT_FOUND)) {
                log.info("SAGA compensation skipped: bookingId={}, reason={}", bookingId, e.getMessage());
                return;
            }
            throw e;
        }
    }
}
