package com.cricverse.common.exception;

import com.cricverse.common.response.ErrorCode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BusinessExceptionTest {

    @Test
    void constructor_withErrorCode_setsDefaultMessage() {
        BusinessException ex = new BusinessException(ErrorCode.SEAT_UNAVAILABLE);

        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.SEAT_UNAVAILABLE);
        assertThat(ex.getMessage()).isEqualTo("Seat is no longer available");
        assertThat(ex.getDetails()).isNull();
    }

    @Test
    void constructor_withCustomMessage_overridesDefault() {
        BusinessException ex = new BusinessException(ErrorCode.SEAT_UNAVAILABLE, "Seat A-12-4 is no longer available");

        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.SEAT_UNAVAILABLE);
        assertThat(ex.getMessage()).isEqualTo("Seat A-12-4 is no longer available");
    }

    @Test
    void constructor_withCause_keepsCause() {
        IllegalStateException cause = new IllegalStateException("lock timeout");
        BusinessException ex = new BusinessException(ErrorCode.PERSISTENCE_FAILURE, "Seat lock wait exceeded", cause);

        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.is(ErrorCode.PERSISTENCE_FAILURE)).isTrue();
        assertThat(ex.is(ErrorCode.SEAT_UNAVAILABLE)).isFalse();
    }
}
