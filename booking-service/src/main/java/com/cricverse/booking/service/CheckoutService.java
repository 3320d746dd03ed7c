package com.cricverse.booking.service;

import com.cricverse.booking.domain.Booking;
import com.cricverse.booking.domain.BookingStatus;
import com.cricverse.booking.domain.IssuedTicket;
import com.cricverse.booking.domain.ReleaseReason;
import com.cricverse.booking.payment.PaymentResult;
import com.cricverse.booking.payment.ResilientPaymentClient;
import com.cricverse.common.exception.BusinessException;
import com.cricverse.common.response.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Synchronous pay-and-confirm for a PENDING booking.
 * No transaction is held across the provider call; the booking engine opens its own.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CheckoutService {

    private final BookingService bookingService;
    private final ResilientPaymentClient paymentClient;

    public CheckoutResult checkout(Long bookingId, Long customerId) {
        Booking booking = bookingService.getBooking(bookingId, customerId);

        if (booking.getStatus() == BookingStatus.CONFIRMED) {
            return CheckoutResult.confirmed(bookingId, booking.getPaymentRef(),
                    bookingService.getIssuedTickets(bookingId));
        }
        if (!booking.isPending()) {
            throw new BusinessException(ErrorCode.INVALID_BOOKING_STATE,
                    "Cannot check out booking " + bookingId + ": current status=" + booking.getStatus());
        }

        PaymentResult payment = charge(booking);
        if (!payment.approved()) {
            log.info("Payment declined: bookingId={}, reason={}", bookingId, payment.declineReason());
            bookingService.releaseBooking(bookingId, ReleaseReason.PAYMENT_FAILED);
            return CheckoutResult.declined(bookingId, payment.declineReason());
        }

        try {
            List<IssuedTicket> tickets = bookingService.confirmBooking(bookingId, payment.paymentRef());
            return CheckoutResult.confirmed(bookingId, payment.paymentRef(), tickets);
        } catch (BusinessException e) {
            if (!e.is(ErrorCode.INVALID_BOOKING_STATE)) {
                throw e;
            }
            log.warn("Reservation lost before confirmation, refunding: bookingId={}, paymentRef={}, reason={}",
                    bookingId, payment.paymentRef(), e.getMessage());
            refundLatePayment(booking, payment.paymentRef());
            return CheckoutResult.refunded(bookingId, payment.paymentRef(),
                    "Reservation expired before payment completed; payment refunded");
        }
    }

    private PaymentResult charge(Booking booking) {
        try {
            return paymentClient.charge(booking.getId(), booking.getCustomerId(), booking.getTotalAmount());
        } catch (BusinessException e) {
            if (e.is(ErrorCode.PAYMENT_UNAVAILABLE)) {
                log.warn("Payment provider unavailable, releasing booking: bookingId={}", booking.getId());
                bookingService.releaseBooking(booking.getId(), ReleaseReason.PAYMENT_TIMEOUT);
            }
            throw e;
        }
    }

    private void refundLatePayment(Booking booking, String paymentRef) {
        paymentClient.refund(paymentRef, booking.getTotalAmount());
        try {
            bookingService.releaseBooking(booking.getId(), ReleaseReason.CONFIRMATION_FAILED);
        } catch (BusinessException e) {
            if (!e.is(ErrorCode.INVALID_BOOKING_STATE)) {
                throw e;
            }
            log.info("Booking settled concurrently, release skipped: bookingId={}", booking.getId());
        }
    }
}
