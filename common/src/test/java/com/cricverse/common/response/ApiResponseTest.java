package com.cricverse.common.response;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ApiResponseTest {

    @Test
    void ok_withData_returnsSuccessResponse() {
        ApiResponse<String> response = ApiResponse.ok("test data");

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getData()).isEqualTo("test data");
        assertThat(response.getError()).isNull();
    }

    @Test
    void ok_withoutData_returnsSuccessResponse() {
        ApiResponse<Void> response = ApiResponse.ok();

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getData()).isNull();
        assertThat(response.getError()).isNull();
    }

    @Test
    void error_withErrorCode_returnsErrorResponse() {
        ApiResponse<Void> response = ApiResponse.error(ErrorCode.RESOURCE_NOT_FOUND);

        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getData()).isNull();
        assertThat(response.getError()).isNotNull();
        assertThat(response.getError().getCode()).isEqualTo("C002");
        assertThat(response.getError().getMessage()).isEqualTo("Resource not found");
        assertThat(response.getError().getDetails()).isNull();
    }

    @Test
    void error_withCustomMessage_returnsErrorResponse() {
        ApiResponse<Void> response = ApiResponse.error(ErrorCode.INVALID_INPUT, "seatIds must not be empty");

        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getError().getCode()).isEqualTo("C001");
        assertThat(response.getError().getMessage()).isEqualTo("seatIds must not be empty");
    }

    @Test
    void error_withDetails_carriesDetails() {
        ApiResponse<Void> response = ApiResponse.error(ErrorCode.SEAT_UNAVAILABLE,
                "Seat B-3-7 is no longer available", Map.of("unavailableSeatIds", List.of(7L)));

        assertThat(response.getError().getCode()).isEqualTo("B001");
        assertThat(response.getError().getDetails()).containsEntry("unavailableSeatIds", List.of(7L));
    }
}
