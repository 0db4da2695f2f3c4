package com.flagship.telehealth_booking.common.exception;

public class ForbiddenException extends TelehealthException {

    public ForbiddenException(String message) {
        super(ErrorCode.FORBIDDEN, message);
    }
}
