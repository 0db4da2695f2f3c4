package com.flagship.telehealth_booking.common.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for every failure that maps onto the public error envelope.
 *
 * Details are optional structured values (boundaries, offending statuses, ids)
 * that are rendered verbatim under {@code error.details}.
 */
@Getter
public abstract class TelehealthException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected TelehealthException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    protected TelehealthException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, details, null);
    }

    protected TelehealthException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details == null || details.isEmpty()
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
