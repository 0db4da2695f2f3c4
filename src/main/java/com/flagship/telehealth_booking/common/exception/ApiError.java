package com.flagship.telehealth_booking.common.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Standard API error response: {@code {"error": {"code", "message", "details"?}}}.
 */
@Value
public class ApiError {
    Body error;

    public static ApiError of(ErrorCode code, String message, Map<String, Object> details) {
        return new ApiError(Body.builder()
                .code(code.name())
                .message(message)
                .details(details)
                .build());
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Body {
        String code;
        String message;
        Map<String, Object> details;
    }
}
