package com.flagship.telehealth_booking.video.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class JoinResponse {
    /** roomUrl with the token appended as {@code ?t=}. */
    String joinUrl;
    String roomUrl;
    String token;
    Instant expiresAt;
}
