package com.cricverse.booking.repository;

import com.cricverse.booking.domain.Seat;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SeatRepository extends JpaRepository<Seat, Long> {

    long countByStadiumId(Long stadiumId);
}
