package com.cricverse.booking.domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Physical seat in a stadium. Immutable once created and unaware of events.
 */
@Entity
@Table(name = "seats")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Seat {

    @Id
    private Long id;

    @Column(nullable = false)
    private Long stadiumId;

    @Column(nullable = false, length = 10)
    private String section;

    @Column(nullable = false, length = 10)
    private String rowLabel;

    @Column(nullable = false)
    private Integer seatNumber;

    @Column(nullable = false, length = 20)
    private String seatType;

    @Column(nullable = false)
    private BigDecimal basePrice;

    public Seat(Long id, Long stadiumId, String section, String rowLabel,
                Integer seatNumber, String seatType, BigDecimal basePrice) {
        this.id = id;
        this.stadiumId = stadiumId;
        this.section = section;
        this.rowLabel = rowLabel;
        this.seatNumber = seatNumber;
        this.seatType = seatType;
        this.basePrice = basePrice;
    }

    /** Human-readable position, e.g. {@code N-12-4}. */
    public String label() {
        return label(section, rowLabel, seatNumber);
    }

    public String accessGate() {
        return accessGate(section);
    }

    public static String label(String section, String rowLabel, Integer seatNumber) {
        return section + "-" + rowLabel + "-" + seatNumber;
    }

    public static String accessGate(String section) {
        if (section == null || section.isBlank()) {
            return "Gate A";
        }
        return "Gate " + Character.toUpperCase(section.charAt(0));
    }
}
