package com.flagship.telehealth_booking.common.exception;

public class NotFoundException extends TelehealthException {

    public NotFoundException(String resource, Object id) {
        super(ErrorCode.NOT_FOUND, resource + " not found: " + id);
    }
}
