package com.cricverse.booking.payment;

/**
 * Outcome of a charge or refund at the payment provider.
 */
public record PaymentResult(boolean approved, String paymentRef, String declineReason) {

    public static PaymentResult approved(String paymentRef) {
        return new PaymentResult(true, paymentRef, null);
    }

    public static PaymentResult declined(String declineReason) {
        return new PaymentResult(false, null, declineReason);
    }
}
