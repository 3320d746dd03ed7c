package com.cricverse.booking.payment;

import java.math.BigDecimal;

/**
 * Port to the external payment provider.
 */
public interface PaymentGateway {

    /**
     * Charges the booking total. A decline is a normal result, not an exception.
     */
    PaymentResult charge(Long bookingId, Long customerId, BigDecimal amount);

    PaymentResult refund(String paymentRef, BigDecimal amount);
}
