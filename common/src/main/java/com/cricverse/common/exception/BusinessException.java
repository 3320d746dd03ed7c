package com.cricverse.common.exception;

import com.cricverse.common.response.ErrorCode;
import lombok.Getter;

import java.util.Map;

@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Structured payload rendered next to the error message, e.g. the seats that blocked a reservation.
     * Returns null when the error carries nothing beyond its code and message.
     */
    public Map<String, Object> getDetails() {
        return null;
    }

    public boolean is(ErrorCode code) {
        return this.errorCode == code;
    }
}
