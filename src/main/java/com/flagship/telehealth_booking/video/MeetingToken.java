package com.flagship.telehealth_booking.video;

import lombok.Value;

import java.time.Instant;

@Value
public class MeetingToken {
    String token;
    Instant expiresAt;
}
