package com.flagship.telehealth_booking.common.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown when a status change is not an edge of the consultation state graph.
 */
public class InvalidStatusTransitionException extends TelehealthException {

    public InvalidStatusTransitionException(Enum<?> from, Enum<?> to) {
        super(ErrorCode.INVALID_STATUS_TRANSITION,
                String.format("Cannot transition from %s to %s", from, to),
                details(from, to));
    }

    private static Map<String, Object> details(Enum<?> from, Enum<?> to) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("from", from.name());
        details.put("to", to.name());
        return details;
    }
}
