package com.flagship.telehealth_booking.common.exception;

import java.util.Map;

public class ConflictException extends TelehealthException {

    public ConflictException(String message) {
        super(ErrorCode.CONFLICT, message);
    }

    public ConflictException(String message, Map<String, Object> details) {
        super(ErrorCode.CONFLICT, message, details);
    }
}
