package com.flagship.telehealth_booking.common.exception;

public class UnauthorizedException extends TelehealthException {

    public UnauthorizedException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }
}
