package com.cricverse.booking.payment;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * In-process stand-in for the provider. Approves every positive amount up to the configured limit.
 */
@Slf4j
@Component
public class MockPaymentGateway implements PaymentGateway {

    private final BigDecimal declineAbove;

    public MockPaymentGateway(@Value("${cricverse.payment.mock.decline-above:100000}") BigDecimal declineAbove) {
        this.declineAbove = declineAbove;
    }

    @Override
    public PaymentResult charge(Long bookingId, Long customerId, BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            log.warn("Mock charge declined: bookingId={}, amount={}", bookingId, amount);
            return PaymentResult.declined("Invalid amount: " + amount);
        }
        if (amount.compareTo(declineAbove) > 0) {
            log.warn("Mock charge declined: bookingId={}, amount={}, limit={}", bookingId, amount, declineAbove);
            return PaymentResult.declined("Amount exceeds card limit");
        }
        String paymentRef = "PAY-" + UUID.randomUUID();
        log.info("Mock charge approved: bookingId={}, customerId={}, amount={}, paymentRef={}",
                bookingId, customerId, amount, paymentRef);
        return PaymentResult.approved(paymentRef);
    }

    @Override
    public PaymentResult refund(String paymentRef, BigDecimal amount) {
        log.info("Mock refund: paymentRef={}, amount={}", paymentRef, amount);
        return PaymentResult.approved("RF-" + UUID.randomUUID());
    }
}
