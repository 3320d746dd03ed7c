package com.cricverse.booking.repository;

import com.cricverse.booking.domain.Booking;
import com.cricverse.booking.domain.BookingStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface BookingRepository extends JpaRepository<Booking, Long> {

    /**
     * Scalar lookup so the seat rows can be locked before the booking row.
     */
    @Query("SELECT b.eventId FROM Booking b WHERE b.id = :id")
    Optional<Long> findEventIdById(@Param("id") Long id);

    @Query("SELECT bs.seatId FROM BookingSeat bs WHERE bs.booking.id = :bookingId ORDER BY bs.seatId ASC")
    List<Long> findSeatIdsByBookingId(@Param("bookingId") Long bookingId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Booking b WHERE b.id = :id")
    Optional<Booking> findByIdForUpdate(@Param("id") Long id);

    @Query("SELECT b.id FROM Booking b WHERE b.status = :status AND b.holdExpiresAt < :now ORDER BY b.id ASC")
    List<Long> findIdsByStatusAndHoldExpiresAtBefore(@Param("status") BookingStatus status,
                                                     @Param("now") LocalDateTime now,
                                                     Pageable pageable);

    @Query("SELECT DISTINCT b FROM Booking b LEFT JOIN FETCH b.bookingSeats WHERE b.customerId = :customerId ORDER BY b.createdAt DESC")
    List<Booking> findByCustomerIdWithSeats(@Param("customerId") Long customerId);

    @Query("SELECT b FROM Booking b LEFT JOIN FETCH b.bookingSeats WHERE b.id = :id")
    Optional<Booking> findByIdWithSeats(@Param("id") Long id);
}
