package com.cricverse.booking.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeatStateTest {

    @Test
    void legalTransitions() {
        assertThat(SeatState.FREE.canTransitionTo(SeatState.RESERVED)).isTrue();
        assertThat(SeatState.RESERVED.canTransitionTo(SeatState.BOOKED)).isTrue();
        assertThat(SeatState.RESERVED.canTransitionTo(SeatState.FREE)).isTrue();
        assertThat(SeatState.BOOKED.canTransitionTo(SeatState.FREE)).isTrue();
    }

    @Test
    void freeCannotJumpToBooked() {
        assertThat(SeatState.FREE.canTransitionTo(SeatState.BOOKED)).isFalse();
        assertThatThrownBy(() -> SeatState.FREE.requireTransitionTo(SeatState.BOOKED))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("FREE -> BOOKED");
    }

    @Test
    void bookedCannotBeReservedAgain() {
        assertThat(SeatState.BOOKED.canTransitionTo(SeatState.RESERVED)).isFalse();
        assertThat(SeatState.BOOKED.canTransitionTo(SeatState.BOOKED)).isFalse();
    }
}
