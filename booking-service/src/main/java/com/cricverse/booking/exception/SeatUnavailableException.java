package com.cricverse.booking.exception;

import com.cricverse.common.exception.BusinessException;
import com.cricverse.common.response.ErrorCode;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * A reservation lost to a competing holder. Carries the blocking seat ids so
 * clients can refresh their seat map and let the customer pick again.
 */
@Getter
public class SeatUnavailableException extends BusinessException {

    private final List<Long> unavailableSeatIds;

    public SeatUnavailableException(List<Long> unavailableSeatIds, String message) {
        super(ErrorCode.SEAT_UNAVAILABLE, message);
        this.unavailableSeatIds = List.copyOf(unavailableSeatIds);
    }

    @Override
    public Map<String, Object> getDetails() {
        return Map.of("unavailableSeatIds", unavailableSeatIds);
    }
}
