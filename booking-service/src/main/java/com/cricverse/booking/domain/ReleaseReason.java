package com.cricverse.booking.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ReleaseReason {
    PAYMENT_FAILED(BookingStatus.FAILED),
    PAYMENT_TIMEOUT(BookingStatus.FAILED),
    EXPIRED(BookingStatus.FAILED),
    CONFIRMATION_FAILED(BookingStatus.FAILED),
    CUSTOMER_CANCELLED(BookingStatus.CANCELLED);

    private final BookingStatus resultingStatus;
}
