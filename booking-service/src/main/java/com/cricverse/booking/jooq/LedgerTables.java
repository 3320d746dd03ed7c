package com.cricverse.booking.jooq;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.DSL;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Table and column references used by the hot-path ledger queries.
 * Mirrors schema.sql; keep both in sync.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class LedgerTables {

    public static final SeatAvailabilityTable SEAT_AVAILABILITY = new SeatAvailabilityTable();
    public static final SeatsTable SEATS = new SeatsTable();
    public static final BookingsTable BOOKINGS = new BookingsTable();
    public static final TicketsTable TICKETS = new TicketsTable();

    public static final class SeatAvailabilityTable {
        private static final String NAME = "seat_availability";

        public final Table<Record> TABLE = DSL.table(DSL.name(NAME));
        public final Field<Long> ID = column(NAME, "id", Long.class);
        public final Field<Long> SEAT_ID = column(NAME, "seat_id", Long.class);
        public final Field<Long> EVENT_ID = column(NAME, "event_id", Long.class);
        public final Field<String> STATE = column(NAME, "state", String.class);
        public final Field<Long> HOLDER_CUSTOMER_ID = column(NAME, "holder_customer_id", Long.class);
        public final Field<Long> BOOKING_ID = column(NAME, "booking_id", Long.class);
        public final Field<LocalDateTime> EXPIRES_AT = column(NAME, "expires_at", LocalDateTime.class);
        public final Field<Long> VERSION = column(NAME, "version", Long.class);
        public final Field<LocalDateTime> UPDATED_AT = column(NAME, "updated_at", LocalDateTime.class);

        private SeatAvailabilityTable() {
        }
    }

    public static final class SeatsTable {
        private static final String NAME = "seats";

        public final Table<Record> TABLE = DSL.table(DSL.name(NAME));
        public final Field<Long> ID = column(NAME, "id", Long.class);
        public final Field<Long> STADIUM_ID = column(NAME, "stadium_id", Long.class);
        public final Field<String> SECTION = column(NAME, "section", String.class);
        public final Field<String> ROW_LABEL = column(NAME, "row_label", String.class);
        public final Field<Integer> SEAT_NUMBER = column(NAME, "seat_number", Integer.class);
        public final Field<String> SEAT_TYPE = column(NAME, "seat_type", String.class);
        public final Field<BigDecimal> BASE_PRICE = column(NAME, "base_price", BigDecimal.class);

        private SeatsTable() {
        }
    }

    public static final class BookingsTable {
        private static final String NAME = "bookings";

        public final Table<Record> TABLE = DSL.table(DSL.name(NAME));
        public final Field<Long> ID = column(NAME, "id", Long.class);
        public final Field<String> STATUS = column(NAME, "status", String.class);

        private BookingsTable() {
        }
    }

    public static final class TicketsTable {
        private static final String NAME = "tickets";

        public final Table<Record> TABLE = DSL.table(DSL.name(NAME));
        public final Field<Long> ID = column(NAME, "id", Long.class);
        public final Field<Long> EVENT_ID = column(NAME, "event_id", Long.class);
        public final Field<Long> SEAT_ID = column(NAME, "seat_id", Long.class);
        public final Field<String> STATUS = column(NAME, "status", String.class);

        private TicketsTable() {
        }
    }

    private static <T> Field<T> column(String table, String column, Class<T> type) {
        return DSL.field(DSL.name(table, column), type);
    }
}
