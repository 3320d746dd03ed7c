package com.cricverse.booking.service;

import com.cricverse.booking.config.BookingProperties;
import com.cricverse.booking.domain.Booking;
import com.cricverse.booking.domain.IssuedTicket;
import com.cricverse.booking.domain.ReleaseReason;
import com.cricverse.booking.exception.PersistenceFailures;
import com.cricverse.booking.repository.BookingRepository;
import com.cricverse.booking.repository.CustomerRepository;
import com.cricverse.booking.repository.EventRepository;
import com.cricverse.booking.repository.TicketRepository;
import com.cricverse.common.exception.BusinessException;
import com.cricverse.common.response.ErrorCode;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;

/**
 * Entry point of the booking engine. Validates input, translates driver failures into
 * PERSISTENCE_FAILURE and retries those; each attempt runs in a fresh transaction in
 * {@link BookingTransactionService}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService {

    private static final String RETRY = "bookingPersistence";

    private final BookingTransactionService transactionService;
    private final BookingRepository bookingRepository;
    private final TicketRepository ticketRepository;
    private final CustomerRepository customerRepository;
    private final EventRepository eventRepository;
    private final BookingProperties properties;

    @Retry(name = RETRY)
    public Booking reserveSeats(Long customerId, Long eventId, List<Long> seatIds) {
        log.info("Reserve seats: customerId={}, eventId={}, seatIds={}", customerId, eventId, seatIds);
        validateSeatIds(seatIds);

        return PersistenceFailures.guard("reserveSeats", () -> {
            if (!customerRepository.existsById(customerId)) {
                throw new BusinessException(ErrorCode.CUSTOMER_NOT_FOUND, "Customer not found: " + customerId);
            }
            if (!eventRepository.existsById(eventId)) {
                throw new BusinessException(ErrorCode.EVENT_NOT_FOUND, "Event not found: " + eventId);
            }
            return transactionService.reserveSeats(customerId, eventId, seatIds);
        });
    }

    @Retry(name = RETRY)
    public List<IssuedTicket> confirmBooking(Long bookingId, String paymentRef) {
        log.info("Confirming booking: bookingId={}, paymentRef={}", bookingId, paymentRef);
        return PersistenceFailures.guard("confirmBooking",
                () -> transactionService.confirmBooking(bookingId, paymentRef));
    }

    @Retry(name = RETRY)
    public Booking releaseBooking(Long bookingId, ReleaseReason reason) {
        log.info("Releasing booking: bookingId={}, reason={}", bookingId, reason);
        return PersistenceFailures.guard("releaseBooking",
                () -> transactionService.releaseBooking(bookingId, reason));
    }

    /**
     * Customer-initiated cancellation of a PENDING booking.
     */
    @Retry(name = RETRY)
    public Booking cancelBooking(Long bookingId, Long customerId) {
        log.info("Cancelling booking: bookingId={}, customerId={}", bookingId, customerId);
        return PersistenceFailures.guard("cancelBooking", () -> {
            requireOwner(findBooking(bookingId), customerId);
            return transactionService.releaseBooking(bookingId, ReleaseReason.CUSTOMER_CANCELLED);
        });
    }

    @Transactional(readOnly = true)
    public Booking getBooking(Long bookingId, Long customerId) {
        Booking booking = bookingRepository.findByIdWithSeats(bookingId)
                .orElseThrow(() -> bookingNotFound(bookingId));
        requireOwner(booking, customerId);
        return booking;
    }

    @Transactional(readOnly = true)
    public List<Booking> getCustomerBookings(Long customerId) {
        return bookingRepository.findByCustomerIdWithSeats(customerId);
    }

    @Transactional(readOnly = true)
    public List<IssuedTicket> getIssuedTickets(Long bookingId) {
        return ticketRepository.findByBookingIdOrderByIdAsc(bookingId).stream()
                .map(IssuedTicket::from)
                .toList();
    }

    private void validateSeatIds(List<Long> seatIds) {
        if (seatIds == null || seatIds.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "At least one seat is required");
        }
        if (seatIds.contains(null)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Seat ids must not be null");
        }
        if (new HashSet<>(seatIds).size() != seatIds.size()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Duplicate seat ids: " + seatIds);
        }
        if (seatIds.size() > properties.getMaxSeatsPerBooking()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "At most " + properties.getMaxSeatsPerBooking() + " seats per booking");
        }
    }

    private Booking findBooking(Long bookingId) {
        return bookingRepository.findById(bookingId)
                .orElseThrow(() -> bookingNotFound(bookingId));
    }

    private static void requireOwner(Booking booking, Long customerId) {
        if (!booking.isOwnedBy(customerId)) {
            throw new BusinessException(ErrorCode.FORBIDDEN,
                    "Customer does not own booking: " + booking.getId());
        }
    }

    private static BusinessException bookingNotFound(Long bookingId) {
        return new BusinessException(ErrorCode.BOOKING_NOT_FOUND, "Booking not found: " + bookingId);
    }
}
