package com.cricverse.booking.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "cricverse.booking")
public class BookingProperties {

    /**
     * How long a reservation holds its seats before the sweep may release it.
     */
    private Duration reservationWindow = Duration.ofMinutes(10);

    /**
     * Upper bound on waiting for a contended seat row lock.
     */
    private Duration lockTimeout = Duration.ofSeconds(3);

    private int maxSeatsPerBooking = 10;

    private Sweep sweep = new Sweep();

    @Getter
    @Setter
    public static class Sweep {
        private long intervalMs = 30_000;
        private int batchSize = 100;
    }
}
