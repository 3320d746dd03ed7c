package com.cricverse.booking;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@OpenAPIDefinition(info = @Info(
        title = "CricVerse Booking API",
        description = "Seat reservation, checkout and ticket lifecycle for cricket events",
        version = "1.0.0"
))
@SpringBootApplication(scanBasePackages = {"com.cricverse.booking", "com.cricverse.common.exception"})
@EnableScheduling
public class BookingServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(BookingServiceApplication.class, args);
    }
}
