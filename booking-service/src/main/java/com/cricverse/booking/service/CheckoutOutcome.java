package com.cricverse.booking.service;

public enum CheckoutOutcome {
    CONFIRMED,
    DECLINED,
    /** Payment went through but the reservation was gone; the charge was refunded. */
    REFUNDED
}
