package com.cricverse.booking.payment;

import com.cricverse.common.exception.BusinessException;
import com.cricverse.common.response.ErrorCode;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Guards provider calls with a circuit breaker. Charges are never retried here since a
 * lost response may still have moved money; refunds are idempotent per paymentRef and are.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResilientPaymentClient {

    private final PaymentGateway paymentGateway;

    @CircuitBreaker(name = "paymentGateway", fallbackMethod = "chargeFallback")
    public PaymentResult charge(Long bookingId, Long customerId, BigDecimal amount) {
        return paymentGateway.charge(bookingId, customerId, amount);
    }

    @Retry(name = "paymentRefund")
    @CircuitBreaker(name = "paymentGateway", fallbackMethod = "refundFallback")
    public PaymentResult refund(String paymentRef, BigDecimal amount) {
        return paymentGateway.refund(paymentRef, amount);
    }

    @SuppressWarnings("unused")
    private PaymentResult chargeFallback(Long bookingId, Long customerId, BigDecimal amount, Throwable t) {
        log.error("Payment provider unavailable for charge: bookingId={}, amount={}, error={}",
                bookingId, amount, t.getMessage());
        throw new BusinessException(ErrorCode.PAYMENT_UNAVAILABLE,
                "Payment provider unavailable", t);
    }

    @SuppressWarnings("unused")
    private PaymentResult refundFallback(String paymentRef, BigDecimal amount, Throwable t) {
        log.error("Payment provider unavailable for refund: paymentRef={}, amount={}, error={}",
                paymentRef, amount, t.getMessage());
        throw new BusinessException(ErrorCode.PAYMENT_UNAVAILABLE,
                "Refund could not be submitted for " + paymentRef, t);
    }
}
