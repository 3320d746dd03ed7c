package com.cricverse.common.event;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Payment outcome reported asynchronously by the payment provider webhook bridge.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PaymentEvent extends DomainEvent {

    public static final String TYPE_COMPLETED = "PAYMENT_COMPLETED";
    public static final String TYPE_FAILED = "PAYMENT_FAILED";

    private String paymentRef;
    private Long bookingId;
    private Long customerId;
    private BigDecimal amount;
    private String failureReason;

    private PaymentEvent(String eventType, String paymentRef, Long bookingId, Long customerId,
                         BigDecimal amount, String failureReason) {
        super(eventType);
        this.paymentRef = paymentRef;
        this.bookingId = bookingId;
        this.customerId = customerId;
        this.amount = amount;
        this.failureReason = failureReason;
    }

    public static PaymentEvent completed(String paymentRef, Long bookingId, Long customerId, BigDecimal amount) {
        return new PaymentEvent(TYPE_COMPLETED, paymentRef, bookingId, customerId, amount, null);
    }

    public static PaymentEvent failed(Long bookingId, Long customerId, BigDecimal amount, String failureReason) {
        return new PaymentEvent(TYPE_FAILED, null, bookingId, customerId, amount, failureReason);
    }
}
