package com.cricverse.booking.repository;

import com.cricverse.booking.domain.Ticket;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface TicketRepository extends JpaRepository<Ticket, Long> {

    List<Ticket> findByBookingIdOrderByIdAsc(Long bookingId);

    List<Ticket> findByCustomerIdOrderByIdDesc(Long customerId);

    @Query("SELECT new com.cricverse.booking.repository.TicketLocation(t.id, t.eventId, t.seatId, t.bookingId) "
            + "FROM Ticket t WHERE t.id = :id")
    Optional<TicketLocation> findLocationById(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM Ticket t WHERE t.id = :id")
    Optional<Ticket> findByIdForUpdate(@Param("id") Long id);
}
