package com.cricverse.booking.domain;

import com.cricverse.common.domain.BaseTimeEntity;
import com.cricverse.common.exception.BusinessException;
import com.cricverse.common.response.ErrorCode;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * One checkout attempt over one or more seats of a single event.
 * PENDING while its seats are reserved; CONFIRMED, FAILED and CANCELLED are terminal.
 */
@Entity
@Table(name = "bookings")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Booking extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long customerId;

    @Column(nullable = false)
    private Long eventId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BookingStatus status;

    @Column(nullable = false)
    private BigDecimal totalAmount;

    private LocalDateTime holdExpiresAt;

    @Enumerated(EnumType.STRING)
    @Column(length = 30)
    private ReleaseReason releaseReason;

    @Column(length = 64)
    private String paymentRef;

    @OneToMany(mappedBy = "booking", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("seatId ASC")
    private List<BookingSeat> bookingSeats = new ArrayList<>();

    @Builder
    private Booking(Long customerId, Long eventId, LocalDateTime holdExpiresAt) {
        this.customerId = customerId;
        this.eventId = eventId;
        this.status = BookingStatus.PENDING;
        this.totalAmount = BigDecimal.ZERO;
        this.holdExpiresAt = holdExpiresAt;
    }

    public void addSeat(Long seatId, BigDecimal price) {
        BookingSeat bookingSeat = new BookingSeat(this, seatId, price);
        this.bookingSeats.add(bookingSeat);
        this.totalAmount = this.totalAmount.add(price);
    }

    public List<Long> getSeatIds() {
        return bookingSeats.stream()
                .map(BookingSeat::getSeatId)
                .sorted()
                .toList();
    }

    public void confirm(String paymentRef) {
        if (this.status != BookingStatus.PENDING) {
            throw new BusinessException(ErrorCode.INVALID_BOOKING_STATE,
                    "Cannot confirm booking " + id + ": current status=" + this.status);
        }
        this.status = BookingStatus.CONFIRMED;
        this.holdExpiresAt = null;
        if (paymentRef != null) {
            this.paymentRef = paymentRef;
        }
    }

    /**
     * Moves a pending booking to FAILED or CANCELLED depending on the reason.
     * Returns false when the booking was already released.
     */
    public boolean release(ReleaseReason reason) {
        if (this.status.isTerminalRelease()) {
            return false; // idempotent
        }
        if (this.status == BookingStatus.CONFIRMED) {
            throw new BusinessException(ErrorCode.INVALID_BOOKING_STATE,
                    "Cannot release confirmed booking " + id);
        }
        this.status = reason.getResultingStatus();
        this.releaseReason = reason;
        this.holdExpiresAt = null;
        return true;
    }

    public void recordPaymentRef(String paymentRef) {
        this.paymentRef = paymentRef;
    }

    public boolean isPending() {
        return this.status == BookingStatus.PENDING;
    }

    public boolean isOwnedBy(Long customerId) {
        return this.customerId.equals(customerId);
    }

    public boolean isExpired(LocalDateTime now) {
        return this.status == BookingStatus.PENDING
                && this.holdExpiresAt != null
                && now.isAfter(this.holdExpiresAt);
    }
}
