package com.cricverse.booking.config;

import com.cricverse.common.exception.BusinessException;
import com.cricverse.common.response.ErrorCode;

import java.util.function.Predicate;

/**
 * Retry only transient persistence failures. Business outcomes such as
 * SEAT_UNAVAILABLE or INVALID_BOOKING_STATE are final for the caller.
 * Referenced from application.yml ({@code resilience4j.retry.instances.bookingPersistence}).
 */
public class PersistenceFailureRetryPredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        return throwable instanceof BusinessException be && be.is(ErrorCode.PERSISTENCE_FAILURE);
    }
}
