package com.cricverse.booking.repository;

import com.cricverse.booking.domain.Event;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EventRepository extends JpaRepository<Event, Long> {
}
