package com.cricverse.booking.saga;

import com.cricverse.booking.domain.ReleaseReason;
import com.cricverse.booking.event.IdempotencyService;
import com.cricverse.booking.payment.PaymentResult;
import com.cricverse.booking.payment.ResilientPaymentClient;
import com.cricverse.booking.service.BookingService;
import com.cricverse.common.event.PaymentEvent;
import com.cricverse.common.event.Topics;
import com.cricverse.common.exception.BusinessException;
import com.cricverse.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * Drives bookings paid through the asynchronous provider flow:
 * payment.completed confirms the booking, payment.failed releases it.
 *
 * <p>A completed payment for a booking that can no longer be confirmed is refunded, whether the
 * release happens here (CONFIRMATION_FAILED) or the expiry sweep already failed the booking.
 * Storage and refund failures propagate so the listener retries and finally dead-letters the record.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingSagaOrchestrator {

    private final BookingService bookingService;
    private final CompensationHandler compensationHandler;
    private final IdempotencyService idempotencyService;
    private final ResilientPaymentClient paymentClient;

    @KafkaListener(topics = Topics.PAYMENT_COMPLETED, groupId = "booking-saga")
    public void onPaymentCompleted(PaymentEvent event) {
        if (idempotencyService.isDuplicate(event.getMessageId(), Topics.PAYMENT_COMPLETED)) {
            log.debug("Duplicate payment-completed message skipped: messageId={}", event.getMessageId());
            return;
        }

        log.info("SAGA: payment completed - bookingId={}, paymentRef={}",
                event.getBookingId(), event.getPaymentRef());

        try {
            bookingService.confirmBooking(event.getBookingId(), event.getPaymentRef());
            log.info("SAGA completed successfully: bookingId={}", event.getBookingId());
        } catch (BusinessException e) {
            if (!e.is(ErrorCode.INVALID_BOOKING_STATE)) {
                throw e;
            }
            log.warn("SAGA confirm rejected, compensating: bookingId={}, reason={}",
                    event.getBookingId(), e.getMessage());
            compensationHandler.compensate(event.getBookingId(), ReleaseReason.CONFIRMATION_FAILED);
            refundLatePayment(event);
        }
        idempotencyService.markProcessed(event.getMessageId(), Topics.PAYMENT_COMPLETED);
    }

    @KafkaListener(topics = Topics.PAYMENT_FAILED, groupId = "booking-saga")
    public void onPaymentFailed(PaymentEvent event) {
        if (idempotencyService.isDuplicate(event.getMessageId(), Topics.PAYMENT_FAILED)) {
            log.debug("Duplicate payment-failed message skipped: messageId={}", event.getMessageId());
            return;
        }

        log.info("SAGA: payment failed - bookingId={}, reason={}",
                event.getBookingId(), event.getFailureReason());

        compensationHandler.compensate(event.getBookingId(), ReleaseReason.PAYMENT_FAILED);
        idempotencyService.markProcessed(event.getMessageId(), Topics.PAYMENT_FAILED);
    }

    private void refundLatePayment(PaymentEvent event) {
        PaymentResult refund = paymentClient.refund(event.getPaymentRef(), event.getAmount());
        if (!refund.approved()) {
            log.error("SAGA refund rejected by provider: bookingId={}, paymentRef={}, reason={}",
                    event.getBookingId(), event.getPaymentRef(), refund.declineReason());
            return;
        }
        log.info("SAGA refund submitted: bookingId={}, paymentRef={}, amount={}",
                event.getBookingId(), event.getPaymentRef(), event.getAmount());
    }
}
