package com.cricverse.booking.domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Occupancy of one seat for one event. Rows are never deleted, only transitioned,
 * and every transition is applied by the seat ledger under a row lock.
 */
@Entity
@Table(name = "seat_availability",
        uniqueConstraints = @UniqueConstraint(name = "uk_seat_availability_seat_event",
                columnNames = {"seat_id", "event_id"}),
        indexes = @Index(name = "idx_seat_availability_sweep", columnList = "event_id, state, expires_at"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SeatAvailability {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long seatId;

    @Column(nullable = false)
    private Long eventId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SeatState state;

    private Long holderCustomerId;

    private Long bookingId;

    private LocalDateTime expiresAt;

    @Version
    private Long version;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    public SeatAvailability(Long seatId, Long eventId, SeatState state, Long holderCustomerId,
                            Long bookingId, LocalDateTime expiresAt, LocalDateTime updatedAt) {
        this.seatId = seatId;
        this.eventId = eventId;
        this.state = state;
        this.holderCustomerId = holderCustomerId;
        this.bookingId = bookingId;
        this.expiresAt = expiresAt;
        this.updatedAt = updatedAt;
    }

    public boolean isReservationExpired(LocalDateTime now) {
        return state == SeatState.RESERVED && expiresAt != null && expiresAt.isBefore(now);
    }

    /**
     * State as seen by a customer: an expired reservation counts as free.
     */
    public SeatState effectiveState(LocalDateTime now) {
        return isReservationExpired(now) ? SeatState.FREE : state;
    }
}
