package com.cricverse.booking.jooq;

import org.jooq.DSLContext;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Minimal H2 schema and fixture rows for ledger tests.
 */
final class LedgerSchema {

    static final Long STADIUM_ID = 1L;
    static final Long EVENT_ID = 3L;
    static final Long OTHER_EVENT_ID = 4L;

    private LedgerSchema() {}

    static void create(DSLContext dsl) {
        dsl.execute("""
                CREATE TABLE IF NOT EXISTS seats (
                    id BIGINT PRIMARY KEY,
                    stadium_id BIGINT NOT NULL,
                    section VARCHAR(10) NOT NULL,
                    row_label VARCHAR(10) NOT NULL,
                    seat_number INTEGER NOT NULL,
                    seat_type VARCHAR(20) NOT NULL,
                    base_price DECIMAL(10,2) NOT NULL
                )
                """);
        dsl.execute("""
                CREATE TABLE IF NOT EXISTS bookings (
                    id BIGINT PRIMARY KEY,
                    status VARCHAR(20) NOT NULL
                )
                """);
        dsl.execute("""
                CREATE TABLE IF NOT EXISTS seat_availability (
                    id BIGINT AUTO_INCREMENT PRIMARY KEY,
                    seat_id BIGINT NOT NULL,
                    event_id BIGINT NOT NULL,
                    state VARCHAR(20) NOT NULL,
                    holder_customer_id BIGINT,
                    booking_id BIGINT,
                    expires_at TIMESTAMP,
                    version BIGINT NOT NULL DEFAULT 0,
                    updated_at TIMESTAMP NOT NULL,
                    CONSTRAINT uk_seat_availability_seat_event UNIQUE (seat_id, event_id)
                )
                """);
        dsl.execute("""
                CREATE TABLE IF NOT EXISTS tickets (
                    id BIGINT PRIMARY KEY,
                    event_id BIGINT NOT NULL,
                    seat_id BIGINT NOT NULL,
                    status VARCHAR(20) NOT NULL
                )
                """);
    }

    static void reset(DSLContext dsl) {
        dsl.execute("DELETE FROM tickets");
        dsl.execute("DELETE FROM seat_availability");
        dsl.execute("DELETE FROM bookings");
        dsl.execute("DELETE FROM seats");
    }

    /**
     * Seats 101..105: section N row 1 (101-103), section S row 2 (104-105).
     */
    static void insertStadiumSeats(DSLContext dsl) {
        for (int i = 1; i <= 5; i++) {
            dsl.execute("INSERT INTO seats (id, stadium_id, section, row_label, seat_number, seat_type, base_price) "
                            + "VALUES (?, ?, ?, ?, ?, ?, ?)",
                    100L + i, STADIUM_ID, i <= 3 ? "N" : "S", i <= 3 ? "1" : "2", i,
                    "STANDARD", new BigDecimal(i <= 3 ? "2500.00" : "1500.00"));
        }
    }

    static void insertBooking(DSLContext dsl, Long id, String status) {
        dsl.execute("INSERT INTO bookings (id, status) VALUES (?, ?)", id, status);
    }

    static void insertTicket(DSLContext dsl, Long id, Long eventId, Long seatId, String status) {
        dsl.execute("INSERT INTO tickets (id, event_id, seat_id, status) VALUES (?, ?, ?, ?)",
                id, eventId, seatId, status);
    }

    static void setRow(DSLContext dsl, Long eventId, Long seatId, String state, Long bookingId,
                       LocalDateTime expiresAt) {
        dsl.execute("UPDATE seat_availability SET state = ?, booking_id = ?, holder_customer_id = ?, expires_at = ? "
                        + "WHERE event_id = ? AND seat_id = ?",
                state, bookingId, bookingId == null ? null : 7L, expiresAt, eventId, seatId);
    }
}
