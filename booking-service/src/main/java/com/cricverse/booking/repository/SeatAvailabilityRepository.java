package com.cricverse.booking.repository;

import com.cricverse.booking.domain.SeatAvailability;
import org.springframework.data.repository.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Read-only access for display. Rows are never saved or deleted through JPA;
 * every write goes through SeatAvailabilityJooqRepository under the row lock.
 */
public interface SeatAvailabilityRepository extends Repository<SeatAvailability, Long> {

    List<SeatAvailability> findByEventIdAndSeatIdIn(Long eventId, Collection<Long> seatIds);

    long countByEventId(Long eventId);
}
